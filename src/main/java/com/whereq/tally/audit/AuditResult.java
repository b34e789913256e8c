package com.whereq.tally.audit;

public enum AuditResult {
    SUCCESS,
    FAILURE
}
