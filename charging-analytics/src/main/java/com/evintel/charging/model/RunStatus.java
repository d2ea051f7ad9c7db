package com.evintel.charging.model;

public enum RunStatus {
    SUCCESS, PARTIAL, FAILED
}
