package com.myinfra.deployments.ownership.model;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ApplicationsRequest(
        @NotNull List<Application> applications) {
}
