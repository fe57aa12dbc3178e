package com.ogt.jobs.validation;

public enum RecordType {
    STUDENT,
    STAFF,
    SELF_INTERNSHIP
}
