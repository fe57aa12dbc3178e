package com.ogt.jobs.service;

import com.ogt.jobs.dto.JobSubmissionResponse;
import com.ogt.jobs.dto.ValidationPreviewResponse;
import com.ogt.jobs.entity.JobType;
import com.ogt.jobs.exception.BusinessException;
import com.ogt.jobs.validation.ImportSchema;
import com.ogt.jobs.validation.RawRow;
import com.ogt.jobs.validation.RecordValidator;
import com.ogt.jobs.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Importación desde planillas subidas: lectura, validación y alta del job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImportService {

    private final TabularFileParser fileParser;
    private final RecordValidator recordValidator;
    private final JobSubmissionService submissionService;

    public JobSubmissionResponse importFile(MultipartFile file, JobType type, String scopeId,
                                            SubmissionOptions options) {
        ImportSchema schema = requireImportType(type);
        String fileName = originalName(file);
        ValidationResult validation = recordValidator.validate(schema, readRows(file, schema));

        log.info("📥 Archivo {} para {}: {} válidas, {} inválidas", fileName, type,
                validation.getValidCount(), validation.getInvalidCount());

        options.setFileName(fileName);
        return submissionService.submitImport(type, scopeId, validation, options);
    }

    /**
     * Validación en seco: mismo motor que el alta, sin crear ningún job.
     */
    public ValidationPreviewResponse preview(MultipartFile file, JobType type) {
        ImportSchema schema = requireImportType(type);
        ValidationResult validation = recordValidator.validate(schema, readRows(file, schema));

        return ValidationPreviewResponse.builder()
                .fileName(originalName(file))
                .type(type)
                .totalRows(validation.getTotalRows())
                .validCount(validation.getValidCount())
                .invalidCount(validation.getInvalidCount())
                .warningCount(validation.getWarningCount())
                .validRecords(validation.getValid())
                .invalidRecords(validation.getInvalid())
                .build();
    }

    /**
     * Planilla vacía con los encabezados del esquema.
     */
    public byte[] template(JobType type) {
        ImportSchema schema = requireImportType(type);
        try (Workbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {

            Sheet sheet = workbook.createSheet(schema.name());
            Font bold = workbook.createFont();
            bold.setBold(true);
            CellStyle headerStyle = workbook.createCellStyle();
            headerStyle.setFont(bold);

            Row header = sheet.createRow(0);
            List<String> headers = schema.templateHeaders();
            for (int i = 0; i < headers.size(); i++) {
                Cell cell = header.createCell(i);
                cell.setCellValue(headers.get(i));
                cell.setCellStyle(headerStyle);
                sheet.setColumnWidth(i, 22 * 256);
            }

            workbook.write(out);
            return out.toByteArray();
        } catch (IOException e) {
            log.error("❌ Error generando plantilla {}", type, e);
            throw new IllegalStateException("Unable to build import template", e);
        }
    }

    private List<RawRow> readRows(MultipartFile file, ImportSchema schema) {
        if (file == null || file.isEmpty()) {
            throw new BusinessException("Uploaded file is empty");
        }
        try {
            return fileParser.parse(originalName(file), file.getBytes(), schema);
        } catch (IOException e) {
            throw new BusinessException("Unable to read uploaded file: " + e.getMessage(), e);
        }
    }

    private static ImportSchema requireImportType(JobType type) {
        if (type == null || !type.isImport()) {
            throw new BusinessException("Job type " + type + " is not an import type");
        }
        return type.getSchema();
    }

    private static String originalName(MultipartFile file) {
        return file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload";
    }
}
