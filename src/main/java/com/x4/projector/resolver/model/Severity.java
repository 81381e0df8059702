package com.x4.projector.resolver.model;

public enum Severity {
    ERROR,
    WARNING
}
