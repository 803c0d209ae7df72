package com.impetus.impetus_backend.model.dto;

public record AddNodeRequest(String type, String title, Double x, Double y) {}
