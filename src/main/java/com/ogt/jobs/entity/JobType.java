package com.ogt.jobs.entity;

import com.ogt.jobs.validation.ImportSchema;

public enum JobType {
    IMPORT_STUDENTS(ImportSchema.STUDENTS),
    IMPORT_STAFF(ImportSchema.STAFF),
    IMPORT_SELF_INTERNSHIPS(ImportSchema.SELF_INTERNSHIPS),
    GENERATE_REPORT(null);

    private final ImportSchema schema;

    JobType(ImportSchema schema) {
        this.schema = schema;
    }

    /**
     * Schema of the rows an import job carries. Empty for report jobs.
     */
    public ImportSchema getSchema() {
        if (schema == null) {
            throw new IllegalStateException(name() + " no es un job de importación");
        }
        return schema;
    }

    public boolean isImport() {
        return schema != null;
    }
}
