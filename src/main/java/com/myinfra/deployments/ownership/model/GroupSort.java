package com.myinfra.deployments.ownership.model;

public enum GroupSort {
    NAME,
    COUNT
}
