package org.profd.junit.extensions.logging;

public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
