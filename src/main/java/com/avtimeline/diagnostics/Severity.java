package com.avtimeline.diagnostics;

public enum Severity {
    ERROR,
    WARNING
}
