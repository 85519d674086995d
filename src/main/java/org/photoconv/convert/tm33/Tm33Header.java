package org.photoconv.convert.tm33;

import java.time.LocalDate;

/**
 * 测试信息（{@code TestInformation}）。
 *
 * @param standard     标准标识，写在根元素的 {@code standard} 属性上
 * @param laboratory   测试实验室（空则不输出）
 * @param reportNumber 测试报告编号（空则不输出）
 * @param testDate     测试日期（IES 不携带，可为 {@code null}）
 */
public record Tm33Header(
        String standard,
        String laboratory,
        String reportNumber,
        LocalDate testDate
) {

    public static final String STANDARD = "TM-33-18";
}
