package nl.bytesoflife.deltatokn.encoder;

/**
 * One reference designator as it appears in the encoded component listing. Multi-unit parts
 * placed as several symbols share one row.
 */
record ComponentRow(String reference, String type, String value, String footprint, String libId, boolean dnp) {
}
