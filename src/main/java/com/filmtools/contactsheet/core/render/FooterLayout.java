package com.filmtools.contactsheet.core.render;

import com.filmtools.contactsheet.core.layout.SheetLayout;
import com.filmtools.contactsheet.core.layout.SheetSettings;
import com.filmtools.contactsheet.core.model.MetadataField;
import com.filmtools.contactsheet.core.model.MetadataInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Positions of everything drawn in the footer band, in canvas pixels.
 * Text positions are the top of the line box, not the baseline.
 *
 * @param filmTop top of the film line, empty when there is no film value or it would overflow
 */
public record FooterLayout(int lineY,
                           int lineStartX,
                           int lineEndX,
                           int textTop,
                           int lineHeight,
                           int leftX,
                           int rightX,
                           List<String> leftLines,
                           List<String> rightLines,
                           String filmText,
                           OptionalInt filmTop) {

    private static final List<MetadataField> LEFT_FIELDS =
        List.of(MetadataField.DATE, MetadataField.LOCATION, MetadataField.DEVELOPER);
    private static final List<MetadataField> RIGHT_FIELDS =
        List.of(MetadataField.CAMERA, MetadataField.LENS);

    public FooterLayout {
        leftLines = List.copyOf(leftLines);
        rightLines = List.copyOf(rightLines);
    }

    public static FooterLayout compute(SheetLayout layout, MetadataInfo metadata) {
        SheetSettings settings = layout.settings();
        int width = layout.canvas().width();
        int height = layout.canvas().height();
        int margin = settings.margin();
        int gap = settings.unifiedGap();

        int lineY = layout.footerTop();
        int textTop = lineY + gap;
        int lineHeight = settings.lineHeight();

        List<String> left = lines(metadata, LEFT_FIELDS);
        List<String> right = lines(metadata, RIGHT_FIELDS);

        String filmText = metadata.get(MetadataField.FILM)
            .map(value -> MetadataField.FILM.label() + ": " + value)
            .orElse(null);

        OptionalInt filmTop = OptionalInt.empty();
        if (filmText != null) {
            int columnRows = Math.max(left.size(), right.size());
            int top = columnRows == 0 ? textTop : textTop + columnRows * lineHeight + gap;
            if (top + settings.filmLineReserve() <= height - margin) {
                filmTop = OptionalInt.of(top);
            }
        }

        return new FooterLayout(lineY, margin, width - margin, textTop, lineHeight,
            margin, width / 2, left, right, filmText, filmTop);
    }

    /** True when a film value was supplied but does not fit inside the band. */
    public boolean filmOmitted() {
        return filmText != null && filmTop.isEmpty();
    }

    private static List<String> lines(MetadataInfo metadata, List<MetadataField> fields) {
        List<String> out = new ArrayList<>();
        for (MetadataField field : fields) {
            metadata.get(field).ifPresent(value -> out.add(field.label() + ": " + value));
        }
        return out;
    }
}
