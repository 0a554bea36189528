package com.trailtag.core.model;

public enum MediaType {
    IMAGE,
    VIDEO
}
