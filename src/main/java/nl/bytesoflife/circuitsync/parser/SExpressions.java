package nl.bytesoflife.circuitsync.parser;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Small lookup helpers over the raw tree, shared by all file readers.
 */
public final class SExpressions {

    private SExpressions() {
    }

    public static String getTag(SNode node) {
        return node instanceof SNode.SList list ? list.tag() : "";
    }

    public static String getAtomValue(SNode.SList list, int index) {
        if (index >= list.size()) return "";
        SNode node = list.get(index);
        if (node instanceof SNode.SAtom atom) {
            return atom.value();
        }
        return "";
    }

    public static double getDouble(SNode.SList list, int index, double fallback) {
        if (index >= list.size() || !(list.get(index) instanceof SNode.SAtom atom)) {
            return fallback;
        }
        try {
            return Double.parseDouble(atom.value());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public static Optional<SNode.SList> findChild(SNode.SList list, String tag) {
        for (SNode child : list.children()) {
            if (child instanceof SNode.SList childList && tag.equals(childList.tag())) {
                return Optional.of(childList);
            }
        }
        return Optional.empty();
    }

    public static List<SNode.SList> findChildren(SNode.SList list, String tag) {
        List<SNode.SList> result = new ArrayList<>();
        for (SNode child : list.children()) {
            if (child instanceof SNode.SList childList && tag.equals(childList.tag())) {
                result.add(childList);
            }
        }
        return result;
    }

    /**
     * Value of the atom following {@code tag}, e.g. {@code (uuid "...")} gives the uuid.
     */
    public static String childValue(SNode.SList list, String tag) {
        return findChild(list, tag).map(c -> getAtomValue(c, 1)).orElse(null);
    }

    /**
     * The {@code (property "name" "value" ...)} child with the given name.
     */
    public static Optional<SNode.SList> findProperty(SNode.SList list, String name) {
        for (SNode.SList property : findChildren(list, "property")) {
            if (name.equals(getAtomValue(property, 1))) {
                return Optional.of(property);
            }
        }
        return Optional.empty();
    }

    public static String propertyValue(SNode.SList list, String name) {
        return findProperty(list, name).map(p -> getAtomValue(p, 2)).orElse(null);
    }

    /**
     * Replaces the atom at {@code index} keeping its leading whitespace. Returns false when the
     * current value is already equal, so unchanged text is never rewritten.
     */
    public static boolean replaceAtom(SNode.SList list, int index, SNode.SAtom replacement) {
        if (index < list.size() && list.get(index) instanceof SNode.SAtom current
                && current.value().equals(replacement.value())) {
            return false;
        }
        list.set(index, replacement);
        return true;
    }

    /**
     * KiCad number formatting: at most four decimals, no trailing zeros, no negative zero.
     */
    public static String formatNumber(double value) {
        BigDecimal decimal = BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).stripTrailingZeros();
        if (decimal.signum() == 0) {
            return "0";
        }
        return decimal.toPlainString();
    }

    public static boolean isYes(SNode.SList list, String tag) {
        return findChild(list, tag).map(c -> "yes".equals(getAtomValue(c, 1))).orElse(false);
    }
}
