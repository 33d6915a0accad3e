package com.yourapp.pods.deadline_engine.service;

public enum InsertResult {
    CREATED,
    ALREADY_EXISTS
}
