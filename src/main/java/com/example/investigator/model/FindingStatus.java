package com.example.investigator.model;

public enum FindingStatus {
    OK,
    ERROR,
    TIMEOUT
}
