package com.myinfra.deployments.ownership.model;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public record GroupMembershipRequest(
        @NotNull List<String> groups) {
}
