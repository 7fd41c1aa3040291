package com.enterprise.morpher.sql.core;

public enum SortDirection {
    ASC,
    DESC
}
