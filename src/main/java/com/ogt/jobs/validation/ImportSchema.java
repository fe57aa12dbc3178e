package com.ogt.jobs.validation;

import com.ogt.jobs.validation.FieldSpec.Format;

import java.util.*;
import java.util.stream.Collectors;

import static com.ogt.jobs.validation.FieldSpec.identifier;
import static com.ogt.jobs.validation.FieldSpec.optional;
import static com.ogt.jobs.validation.FieldSpec.optionalStrict;
import static com.ogt.jobs.validation.FieldSpec.required;

/**
 * Tabla de campos por tipo de importación. El orden de los identificadores
 * define cuál se usa como clave natural del registro.
 */
public enum ImportSchema {

    STUDENTS(RecordType.STUDENT, "Duplicate student entry in file", List.of(
            required("name", "Name", Format.TEXT, "Student Name"),
            identifier("enrollmentNumber", "Enrollment Number", Format.TEXT, "Admission Number"),
            identifier("rollNumber", "Roll Number", Format.TEXT, "Roll No"),
            identifier("email", "Email", Format.EMAIL, "Student Email"),
            optional("phone", "Phone", Format.PHONE, "Contact"),
            optional("batchName", "Batch", Format.TEXT, "Batch Name"),
            optional("branchName", "Branch", Format.TEXT, "Department"),
            optionalStrict("semester", "Semester", Format.SEMESTER, "Current Semester"),
            optional("dateOfBirth", "Date of Birth", Format.DATE, "DOB"),
            optional("gender", "Gender", Format.TEXT),
            optional("parentName", "Parent Name", Format.TEXT, "Father Name"),
            optional("parentContact", "Parent Contact", Format.PHONE, "Parent Phone")
    )),

    STAFF(RecordType.STAFF, "Duplicate staff entry in file", List.of(
            required("name", "Name", Format.TEXT, "Staff Name"),
            identifier("email", "Email", Format.EMAIL, "Staff Email"),
            identifier("employeeId", "Employee ID", Format.TEXT, "Employee Code", "Staff ID"),
            optional("phone", "Phone", Format.PHONE, "Contact"),
            optional("designation", "Designation", Format.TEXT, "Role"),
            optional("branchName", "Branch", Format.TEXT, "Department")
    )),

    SELF_INTERNSHIPS(RecordType.SELF_INTERNSHIP, "Duplicate student entry in file", List.of(
            identifier("studentEmail", "Student Email", Format.EMAIL, "Email"),
            identifier("rollNumber", "Roll Number", Format.TEXT, "Roll No"),
            identifier("enrollmentNumber", "Enrollment Number", Format.TEXT, "Admission Number"),
            required("companyName", "Company Name", Format.TEXT, "Company"),
            optional("companyAddress", "Company Address", Format.TEXT),
            optional("companyContact", "Company Contact", Format.PHONE, "Company Phone"),
            optional("companyEmail", "Company Email", Format.EMAIL),
            optional("hrName", "HR Name", Format.TEXT, "Contact Person"),
            optional("hrDesignation", "HR Designation", Format.TEXT),
            optional("hrContact", "HR Contact", Format.PHONE, "HR Phone"),
            optional("hrEmail", "HR Email", Format.EMAIL),
            optional("jobProfile", "Job Profile", Format.TEXT, "Position"),
            optional("stipend", "Stipend", Format.TEXT),
            optional("startDate", "Start Date", Format.DATE),
            optional("endDate", "End Date", Format.DATE),
            optional("duration", "Duration", Format.TEXT),
            optional("facultyMentorName", "Faculty Mentor Name", Format.TEXT, "Mentor Name"),
            optional("facultyMentorEmail", "Faculty Mentor Email", Format.EMAIL, "Mentor Email"),
            optional("facultyMentorContact", "Faculty Mentor Contact", Format.PHONE, "Mentor Contact")
    ));

    public static final String SCOPE_FIELD = "scopeId";
    private static final String SCOPE_KEY = "scopeid";

    private final RecordType recordType;
    private final String duplicateMessage;
    private final List<FieldSpec> fields;
    private final Map<String, FieldSpec> byHeaderKey;

    ImportSchema(RecordType recordType, String duplicateMessage, List<FieldSpec> fields) {
        this.recordType = recordType;
        this.duplicateMessage = duplicateMessage;
        this.fields = fields;
        Map<String, FieldSpec> keys = new HashMap<>();
        for (FieldSpec field : fields) {
            // Primer campo gana: "Email" es alias de studentEmail, no de companyEmail
            field.headerKeys().forEach(k -> keys.putIfAbsent(k, field));
        }
        this.byHeaderKey = Collections.unmodifiableMap(keys);
    }

    public RecordType getRecordType() {
        return recordType;
    }

    public String getDuplicateMessage() {
        return duplicateMessage;
    }

    public List<FieldSpec> getFields() {
        return fields;
    }

    public List<FieldSpec> identifierFields() {
        return fields.stream().filter(f -> f.getRole() == FieldSpec.Role.IDENTIFIER).toList();
    }

    public List<FieldSpec> requiredFields() {
        return fields.stream().filter(f -> f.getRole() == FieldSpec.Role.REQUIRED).toList();
    }

    /**
     * Resuelve un encabezado de planilla (o una clave JSON) al campo canónico.
     */
    public Optional<FieldSpec> fieldForHeader(String header) {
        return Optional.ofNullable(byHeaderKey.get(FieldSpec.normalizeHeader(header)));
    }

    /**
     * Primer identificador no vacío, en minúsculas. {@code null} si la fila no tiene ninguno.
     */
    public String resolveIdentifier(Map<String, String> values) {
        for (FieldSpec field : identifierFields()) {
            String value = values.get(field.getName());
            if (value != null && !value.isBlank()) {
                return value.trim().toLowerCase();
            }
        }
        return null;
    }

    public String identifierLabels() {
        List<String> headers = identifierFields().stream().map(FieldSpec::getHeader).toList();
        if (headers.size() == 1) return headers.get(0);
        return String.join(", ", headers.subList(0, headers.size() - 1)) + " or " + headers.get(headers.size() - 1);
    }

    /**
     * Traduce las claves de una fila cruda a los nombres canónicos del esquema.
     * Las columnas desconocidas se descartan salvo {@code scopeId}, que el
     * writer contrasta con la institución del job.
     */
    public Map<String, String> canonicalize(Map<String, String> raw) {
        Map<String, String> values = new LinkedHashMap<>();
        if (raw == null) return values;
        raw.forEach((key, value) -> {
            if (key == null) return;
            Optional<FieldSpec> field = fieldForHeader(key);
            if (field.isPresent()) {
                values.putIfAbsent(field.get().getName(), value);
            } else if (SCOPE_KEY.equals(FieldSpec.normalizeHeader(key))) {
                values.put(SCOPE_FIELD, value);
            }
        });
        return values;
    }

    public List<String> templateHeaders() {
        return fields.stream().map(FieldSpec::getHeader).collect(Collectors.toList());
    }
}
