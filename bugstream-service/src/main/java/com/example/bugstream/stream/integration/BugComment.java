package com.example.bugstream.stream.integration;

public record BugComment(String id, String content, String author) {}
