package org.photoconv.convert.tm33;

/**
 * TM-33-18 文档根对象。
 */
public record Tm33Document(
        Tm33FileInformation fileInformation,
        Tm33Measurement measurement,
        Tm33Header header,
        Tm33Luminaire luminaire,
        Tm33Photometry photometry
) {
}
