package com.example.mailmerge.model;

public enum SendStatus {
    SENT,
    PREVIEWED,
    FAILED
}
