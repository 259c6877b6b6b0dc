package com.worklog.config;

public enum StorageType {
    MEMORY,
    SQLITE
}
