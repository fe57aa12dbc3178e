package com.ogt.jobs.service.report;

import com.lowagie.text.*;
import com.lowagie.text.pdf.PdfPCell;
import com.lowagie.text.pdf.PdfPTable;
import com.lowagie.text.pdf.PdfWriter;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Map;

@Component
public class PdfReportExporter implements ReportExporter {

    private static final Font TITLE_FONT = FontFactory.getFont(FontFactory.HELVETICA_BOLD, 14);
    private static final Font GROUP_FONT = FontFactory.getFont(FontFactory.HELVETICA_BOLD, 10);
    private static final Font HEADER_FONT = FontFactory.getFont(FontFactory.HELVETICA_BOLD, 8);
    private static final Font CELL_FONT = FontFactory.getFont(FontFactory.HELVETICA, 8);

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.PDF;
    }

    @Override
    public byte[] export(ReportTable table) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Document document = new Document(PageSize.A4.rotate(), 24, 24, 24, 24);
        try {
            PdfWriter.getInstance(document, out);
            document.open();
            document.add(new Paragraph(table.getTitle(), TITLE_FONT));
            document.add(new Paragraph(" "));

            List<String> columns = table.getColumns();
            for (ReportTable.Group group : table.getGroups()) {
                if (table.isGrouped()) {
                    document.add(new Paragraph(table.getGroupBy() + ": " + group.getKey()
                            + " (" + group.getRows().size() + ")", GROUP_FONT));
                }
                document.add(buildTable(columns, group.getRows()));
                document.add(new Paragraph(" "));
            }
        } catch (DocumentException e) {
            throw new IOException("Unable to render PDF report", e);
        } finally {
            if (document.isOpen()) document.close();
        }
        return out.toByteArray();
    }

    private static PdfPTable buildTable(List<String> columns, List<Map<String, String>> rows) {
        PdfPTable pdfTable = new PdfPTable(Math.max(columns.size(), 1));
        pdfTable.setWidthPercentage(100);
        pdfTable.setHeaderRows(1);

        for (String column : columns) {
            PdfPCell cell = new PdfPCell(new Phrase(column, HEADER_FONT));
            cell.setGrayFill(0.9f);
            pdfTable.addCell(cell);
        }
        for (Map<String, String> row : rows) {
            for (String column : columns) {
                String value = row.get(column);
                pdfTable.addCell(new Phrase(value != null ? value : "", CELL_FONT));
            }
        }
        return pdfTable;
    }
}
