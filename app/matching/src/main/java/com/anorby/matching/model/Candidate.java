package com.anorby.matching.model;

public record Candidate(long userId, double score) {}
