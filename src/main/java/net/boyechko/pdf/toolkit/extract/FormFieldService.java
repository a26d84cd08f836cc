/*
 * PDF-Toolkit - Command-line PDF page assembly and extraction
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.toolkit.extract;

import com.itextpdf.forms.PdfAcroForm;
import com.itextpdf.forms.fields.PdfButtonFormField;
import com.itextpdf.forms.fields.PdfFormField;
import com.itextpdf.kernel.geom.Rectangle;
import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.annot.PdfAnnotation;
import com.itextpdf.kernel.pdf.annot.PdfWidgetAnnotation;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.boyechko.pdf.toolkit.core.PdfOperationException;
import net.boyechko.pdf.toolkit.document.PdfCustodian;
import net.boyechko.pdf.toolkit.engine.EngineException;
import net.boyechko.pdf.toolkit.engine.EngineLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Lists AcroForm fields, one entry per widget, ordered by page. */
public class FormFieldService {
    private static final Logger logger = LoggerFactory.getLogger(FormFieldService.class);

    public List<FormField> list(PdfCustodian custodian) throws PdfOperationException {
        try (EngineLock.Guard guard = EngineLock.acquire();
                PdfDocument document = custodian.openForReading()) {
            List<FormField> fields = new ArrayList<>();
            PdfAcroForm form = PdfAcroForm.getAcroForm(document, false);
            if (form == null) {
                logger.info("{} has no interactive form", custodian.inputPath());
                return fields;
            }
            for (Map.Entry<String, PdfFormField> entry : form.getAllFormFields().entrySet()) {
                PdfFormField field = entry.getValue();
                if (!field.getChildFormFields().isEmpty()) {
                    continue;
                }
                String type = typeOf(field);
                String value = field.getValueAsString();
                List<PdfWidgetAnnotation> widgets = field.getWidgets();
                if (widgets.isEmpty()) {
                    fields.add(new FormField(null, entry.getKey(), type, value, ""));
                    continue;
                }
                for (PdfWidgetAnnotation widget : widgets) {
                    fields.add(
                            new FormField(
                                    pageOf(document, widget),
                                    entry.getKey(),
                                    type,
                                    value,
                                    formatRect(widget.getRectangle())));
                }
            }
            fields.sort(
                    Comparator.comparing(
                            FormField::page, Comparator.nullsLast(Comparator.naturalOrder())));
            logger.info("Found {} form field(s)", fields.size());
            return fields;
        } catch (EngineException e) {
            throw new PdfOperationException("Failed to read " + custodian.inputPath(), e);
        }
    }

    static String typeOf(PdfFormField field) {
        PdfName formType = field.getFormType();
        if (PdfName.Tx.equals(formType)) {
            return "Text";
        } else if (PdfName.Ch.equals(formType)) {
            return "Choice";
        } else if (PdfName.Sig.equals(formType)) {
            return "Signature";
        } else if (PdfName.Btn.equals(formType)) {
            if (field.getFieldFlag(PdfButtonFormField.FF_PUSH_BUTTON)) {
                return "PushButton";
            }
            return field.getFieldFlag(PdfButtonFormField.FF_RADIO) ? "RadioButton" : "CheckBox";
        }
        return "Unknown";
    }

    private static Integer pageOf(PdfDocument document, PdfWidgetAnnotation widget) {
        PdfPage page = widget.getPage();
        if (page != null) {
            int number = document.getPageNumber(page);
            if (number > 0) {
                return number;
            }
        }
        // Widgets without /P: look them up in the page annotation arrays
        for (int p = 1; p <= document.getNumberOfPages(); p++) {
            for (PdfAnnotation annotation : document.getPage(p).getAnnotations()) {
                if (annotation.getPdfObject() == widget.getPdfObject()) {
                    return p;
                }
            }
        }
        return null;
    }

    static String formatRect(PdfArray rect) {
        if (rect == null) {
            return "";
        }
        Rectangle r = rect.toRectangle();
        return String.format(
                Locale.ROOT,
                "%.2f,%.2f,%.2f,%.2f",
                r.getLeft(),
                r.getBottom(),
                r.getRight(),
                r.getTop());
    }
}
