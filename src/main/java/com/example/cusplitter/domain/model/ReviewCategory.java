package com.example.cusplitter.domain.model;

/**
 * Three-way grouping used when an operator reviews the match table.
 */
public enum ReviewCategory {
    MATCHED,
    NEEDS_EMAIL,
    NO_CERTIFICATE
}
