package org.photoconv.convert.tm33;

/**
 * TM-33 光度对称性。
 * <p>
 * 由水平角数量推断：1 个水平角为轴对称，2 个为双侧对称（通常是 0~180），其余视为无对称。
 */
public enum Tm33Symmetry {
    NONE("None"),
    AXIAL("Axial"),
    BILATERAL("Bilateral");

    private final String label;

    Tm33Symmetry(String label) {
        this.label = label;
    }

    /**
     * 写入 XML 的标签（{@code Symmetry@type}）。
     */
    public String label() {
        return label;
    }

    public static Tm33Symmetry fromHorizontalCount(int horizontalCount) {
        return switch (horizontalCount) {
            case 1 -> AXIAL;
            case 2 -> BILATERAL;
            default -> NONE;
        };
    }
}
