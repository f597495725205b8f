package com.cloudimages.storage;

public enum DeleteOutcome {
    DELETED,
    NOT_FOUND
}
