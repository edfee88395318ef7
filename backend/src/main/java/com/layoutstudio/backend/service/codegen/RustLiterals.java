package com.layoutstudio.backend.service.codegen;

import com.layoutstudio.backend.domain.AlignmentSpec;
import com.layoutstudio.backend.domain.LengthSpec;
import com.layoutstudio.backend.domain.PaddingSpec;

import java.math.BigDecimal;

/**
 * Rust spellings of the literal values carried by a layout.
 */
final class RustLiterals {

    private RustLiterals() {
    }

    static String f32(double v) {
        if (Double.isNaN(v)) return "f32::NAN";
        if (Double.isInfinite(v)) return v > 0 ? "f32::INFINITY" : "f32::NEG_INFINITY";
        String plain = BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
        if (plain.equals("-0")) plain = "0";
        return plain.contains(".") ? plain : plain + ".0";
    }

    static String string(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"') sb.append("\\\"");
            else if (c == '\\') sb.append("\\\\");
            else if (c == '\n') sb.append("\\n");
            else if (c == '\r') sb.append("\\r");
            else if (c == '\t') sb.append("\\t");
            else if (c == '\0') sb.append("\\0");
            else if (c < 0x20 || c == 0x7f) sb.append("\\u{").append(Integer.toHexString(c)).append('}');
            else sb.append(c);
        }
        return sb.append('"').toString();
    }

    static String length(LengthSpec length) {
        if (length instanceof LengthSpec.FillPortion) {
            return "Length::FillPortion(" + ((LengthSpec.FillPortion) length).portion() + ")";
        }
        if (length instanceof LengthSpec.Fixed) {
            return "Length::Fixed(" + f32(((LengthSpec.Fixed) length).pixels()) + ")";
        }
        return length instanceof LengthSpec.Fill ? "Length::Fill" : "Length::Shrink";
    }

    static String alignment(AlignmentSpec alignment) {
        switch (alignment) {
            case CENTER:
                return "Alignment::Center";
            case END:
                return "Alignment::End";
            default:
                return "Alignment::Start";
        }
    }

    static String padding(PaddingSpec p) {
        if (p.top() == p.right() && p.top() == p.bottom() && p.top() == p.left()) {
            return f32(p.top());
        }
        return "Padding { top: " + f32(p.top()) + ", right: " + f32(p.right())
                + ", bottom: " + f32(p.bottom()) + ", left: " + f32(p.left()) + " }";
    }
}
