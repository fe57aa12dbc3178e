package com.ogt.jobs.validation;

import com.ogt.jobs.config.JobProperties;
import com.ogt.jobs.exception.BatchTooLargeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordValidatorTest {

    private RecordValidator validator;

    @BeforeEach
    void setUp() {
        validator = new RecordValidator(new JobProperties());
    }

    @Test
    void duplicateIdentifierInvalidatesOnlyTheLaterRow() {
        List<RawRow> rows = List.of(
                row(2, "name", "Asha", "email", "asha@college.edu"),
                row(3, "name", "Ravi", "email", "ravi@college.edu"),
                row(4, "name", "Asha Again", "email", "ASHA@college.edu"));

        ValidationResult result = validator.validate(ImportSchema.STUDENTS, rows);

        assertThat(result.getValid()).hasSize(2);
        assertThat(result.getInvalid()).hasSize(1);
        ImportRecord duplicate = result.getInvalid().get(0);
        assertThat(duplicate.getRowNumber()).isEqualTo(4);
        assertThat(duplicate.getErrors()).containsExactly("Duplicate student entry in file");
        assertThat(result.getValid()).extracting(ImportRecord::getRowNumber).containsExactly(2, 3);
    }

    @Test
    void rowRepeatingASecondaryIdentifierIsADuplicate() {
        List<RawRow> rows = List.of(
                row(2, "name", "Asha", "rollNumber", "R1", "email", "asha@college.edu"),
                row(3, "name", "Asha Again", "email", "ASHA@COLLEGE.EDU"));

        ValidationResult result = validator.validate(ImportSchema.STUDENTS, rows);

        assertThat(result.getValid()).extracting(ImportRecord::getRowNumber).containsExactly(2);
        assertThat(result.getInvalid()).singleElement().satisfies(record -> {
            assertThat(record.getRowNumber()).isEqualTo(3);
            assertThat(record.getErrors()).containsExactly("Duplicate student entry in file");
        });
    }

    @Test
    void rowRepeatingSeveralIdentifiersIsFlaggedOnce() {
        List<RawRow> rows = List.of(
                row(2, "name", "Asha", "rollNumber", "R1", "email", "asha@college.edu"),
                row(3, "name", "Asha", "rollNumber", "r1", "email", "asha@college.edu"));

        ValidationResult result = validator.validate(ImportSchema.STUDENTS, rows);

        assertThat(result.getInvalid()).singleElement()
                .satisfies(record -> assertThat(record.getErrors()).containsExactly("Duplicate student entry in file"));
    }

    @Test
    void batchOverTheCapIsRejectedBeforeAnyRowIsValidated() {
        List<RawRow> rows = new ArrayList<>();
        for (int i = 0; i < 501; i++) {
            // Filas sin identificador: si se validaran, todas serían inválidas
            rows.add(row(i + 2, "gender", "F"));
        }

        assertThatThrownBy(() -> validator.validate(ImportSchema.STUDENTS, rows))
                .isInstanceOf(BatchTooLargeException.class)
                .hasMessageContaining("Maximum batch size exceeded")
                .hasMessageContaining("501");
    }

    @Test
    void batchAtTheCapIsAccepted() {
        List<RawRow> rows = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            rows.add(row(i + 2, "name", "Student " + i, "rollNumber", "R" + i));
        }

        ValidationResult result = validator.validate(ImportSchema.STUDENTS, rows);

        assertThat(result.getValidCount()).isEqualTo(500);
    }

    @Test
    void missingIdentifierAndRequiredFieldAreErrors() {
        ValidationResult result = validator.validate(ImportSchema.STUDENTS, List.of(row(2, "phone", "9876543210")));

        assertThat(result.getInvalid()).singleElement()
                .satisfies(record -> assertThat(record.getErrors()).containsExactly(
                        "At least one identifier (Enrollment Number, Roll Number or Email) is required",
                        "Name is required"));
    }

    @Test
    void identifyingEmailIsAnErrorButContactFieldsOnlyWarn() {
        List<RawRow> rows = List.of(
                row(2, "name", "Asha", "email", "not-an-email"),
                row(3, "name", "Ravi", "rollNumber", "R-7", "phone", "12345", "dateOfBirth", "07/01/2004"));

        ValidationResult result = validator.validate(ImportSchema.STUDENTS, rows);

        assertThat(result.getInvalid()).singleElement()
                .satisfies(record -> assertThat(record.getErrors()).containsExactly("Invalid Email format"));
        assertThat(result.getValid()).singleElement()
                .satisfies(record -> assertThat(record.getWarnings()).containsExactly(
                        "Invalid Phone format: expected 10 digits",
                        "Invalid date format: 07/01/2004. Expected format: YYYY-MM-DD"));
        assertThat(result.getWarningCount()).isEqualTo(2);
    }

    @Test
    void semesterOutOfRangeInvalidatesTheRow() {
        ValidationResult result = validator.validate(ImportSchema.STUDENTS,
                List.of(row(2, "name", "Asha", "rollNumber", "R1", "semester", "9")));

        assertThat(result.getInvalid()).singleElement()
                .satisfies(record -> assertThat(record.getErrors()).containsExactly("Semester must be between 1 and 8"));
    }

    @Test
    void phoneAcceptsSeparatorsAndCountryPrefix() {
        assertThat(RecordValidator.isValidPhone("+91 98765-43210")).isTrue();
        assertThat(RecordValidator.isValidPhone("(987) 654 3210")).isTrue();
        assertThat(RecordValidator.isValidPhone("919876543210")).isTrue();
        assertThat(RecordValidator.isValidPhone("98765")).isFalse();
    }

    @Test
    void internshipContactEmailsAreWarningsWhileStudentEmailIsAnError() {
        List<RawRow> rows = List.of(
                row(2, "studentEmail", "asha@college.edu", "companyName", "Acme",
                        "hrEmail", "hr-at-acme", "startDate", "2026-13-01"),
                row(3, "studentEmail", "broken", "companyName", "Acme"));

        ValidationResult result = validator.validate(ImportSchema.SELF_INTERNSHIPS, rows);

        assertThat(result.getValid()).singleElement()
                .satisfies(record -> assertThat(record.getWarnings()).containsExactly(
                        "Invalid HR Email format",
                        "Invalid date format: 2026-13-01. Expected format: YYYY-MM-DD"));
        assertThat(result.getInvalid()).singleElement()
                .satisfies(record -> assertThat(record.getErrors()).containsExactly("Invalid Student Email format"));
    }

    @Test
    void staffDuplicatesUseTheStaffMessage() {
        List<RawRow> rows = List.of(
                row(2, "name", "Meera", "employeeId", "E-1"),
                row(3, "name", "Meera K", "employeeId", "e-1"));

        ValidationResult result = validator.validate(ImportSchema.STAFF, rows);

        assertThat(result.getInvalid()).singleElement()
                .satisfies(record -> assertThat(record.getErrors()).containsExactly("Duplicate staff entry in file"));
    }

    @Test
    void identifierIsTheFirstNonBlankIdentifierLowerCased() {
        ValidationResult result = validator.validate(ImportSchema.STUDENTS,
                List.of(row(2, "name", "Asha", "enrollmentNumber", "  ", "rollNumber", "CS-21-07", "email", "a@b.co")));

        assertThat(result.getValid()).singleElement()
                .satisfies(record -> assertThat(record.getIdentifier()).isEqualTo("cs-21-07"));
    }

    @Test
    void everyRowEndsUpValidOrInvalid() {
        List<RawRow> rows = List.of(
                row(2, "name", "A", "email", "a@x.io"),
                row(3, "email", "b@x.io"),
                row(4, "name", "C"),
                row(5, "name", "D", "email", "a@x.io"),
                row(6, "name", "E", "rollNumber", "R6", "semester", "3"));

        ValidationResult result = validator.validate(ImportSchema.STUDENTS, rows);

        assertThat(result.getValidCount() + result.getInvalidCount()).isEqualTo(rows.size());
        assertThat(result.getTotalRows()).isEqualTo(rows.size());
    }

    private static RawRow row(int rowNumber, String... keyValues) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            fields.put(keyValues[i], keyValues[i + 1]);
        }
        return new RawRow(rowNumber, fields);
    }
}
