package org.photoconv.convert.ies.model;

/**
 * 与文件格式无关的通用灯具元信息。
 * <p>
 * {@code inputWatts} 与 {@code totalLumens} 只来源于数值头记录（总光通量 = 灯数 × 单灯光通量），
 * 构造后不可修改。
 *
 * @param manufacturer   制造商（{@code [MANUFAC]}）
 * @param luminaire      灯具型号（{@code [LUMCAT]}）
 * @param catalogNumber  目录号（{@code [CATALOGNUMBER]}）
 * @param lamp           光源描述（{@code [LAMPCAT]}）
 * @param testLaboratory 测试实验室（{@code [TESTLAB]}）
 * @param testReport     测试报告编号（{@code [TEST]}）
 * @param notes          备注（多行 {@code [MORE]} 以换行拼接）
 * @param inputWatts     输入功率
 * @param totalLumens    总光通量
 */
public record CommonHeader(
        String manufacturer,
        String luminaire,
        String catalogNumber,
        String lamp,
        String testLaboratory,
        String testReport,
        String notes,
        double inputWatts,
        double totalLumens
) {
}
