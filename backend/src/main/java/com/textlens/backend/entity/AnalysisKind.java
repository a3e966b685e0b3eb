package com.textlens.backend.entity;

public enum AnalysisKind {
    detection,
    summary,
    generation
}
