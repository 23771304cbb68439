///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

/**
 * The structural keywords of a header, which describe how the data that follows it is laid out.
 * <p>
 * An instance starts out with sentinel values, is filled in by {@link HeaderAssembler} as it reads a header's
 * records, and is read-only to everything else. Indexed keywords like {@code NAXISn} and {@code TBCOLn} are addressed
 * with the 1-based index that appears in the keyword.
 * </p>
 */
public final class HduOptions {

    /** The value of any count that has not been declared. */
    public static final int UNSET = -1;

    /** The largest value of {@code TFIELDS} that the FITS standard allows. */
    static final int MAX_FIELDS = 999;

    private ExtensionKind extensionKind;
    private boolean conforming;
    private boolean extendsFile;
    private boolean hasGroups;
    private boolean inherits;
    private int bitpix;
    private int naxis;
    private int[] shape;
    private long parameterCount;
    private long groupCount;
    private final Map<Integer, Double> parameterScales;
    private final Map<Integer, Double> parameterZeros;
    private int fieldCount;
    private int[] columnStarts;
    private String[] fieldFormats;
    private double[] fieldScales;
    private double[] fieldZeros;
    private String[] fieldNulls;
    private String[] fieldDisplayFormats;
    private long heapOffset;

    HduOptions() {
        extensionKind = null;
        bitpix = 0;
        naxis = UNSET;
        shape = new int[0];

        // The FITS standard gives these values to headers which omit PCOUNT and GCOUNT.
        parameterCount = 0;
        groupCount = 1;
        parameterScales = new TreeMap<>();
        parameterZeros = new TreeMap<>();

        setFieldCount(0);
        fieldCount = UNSET;
        heapOffset = UNSET;
    }

    /**
     * @return The kind of HDU, or {@code null} if neither {@code SIMPLE} nor {@code XTENSION} was given.
     */
    public ExtensionKind extensionKind() {
        return extensionKind;
    }

    void setExtensionKind(ExtensionKind extensionKind) {
        this.extensionKind = extensionKind;
    }

    /**
     * @return {@code true} if the header declared {@code SIMPLE = T}.
     */
    public boolean isConforming() {
        return conforming;
    }

    void setConforming(boolean conforming) {
        this.conforming = conforming;
    }

    /**
     * @return The value of {@code EXTEND}, which tells whether extensions may follow the primary HDU.
     */
    public boolean extendsFile() {
        return extendsFile;
    }

    void setExtendsFile(boolean extendsFile) {
        this.extendsFile = extendsFile;
    }

    /**
     * @return The value of {@code GROUPS}.
     */
    public boolean hasGroups() {
        return hasGroups;
    }

    void setHasGroups(boolean hasGroups) {
        this.hasGroups = hasGroups;
    }

    /**
     * @return The value of {@code INHERIT}.
     */
    public boolean inherits() {
        return inherits;
    }

    void setInherits(boolean inherits) {
        this.inherits = inherits;
    }

    /**
     * @return The value of {@code BITPIX}, or 0 if it was not given.
     */
    public int bitpix() {
        return bitpix;
    }

    void setBitpix(int bitpix) {
        this.bitpix = bitpix;
    }

    /**
     * @return The value of {@code NAXIS}, or {@link #UNSET} if it was not given.
     */
    public int naxis() {
        return naxis;
    }

    /**
     * Sets the number of axes, which discards any axis extents that had been set.
     *
     * @param naxis
     *     The number of axes.
     */
    void setNaxis(int naxis) {
        assert 0 <= naxis : "naxis must not be negative";
        this.naxis = naxis;
        this.shape = new int[naxis];
    }

    /**
     * @return The extent of each axis ({@code NAXIS1}, {@code NAXIS2}, ...). The first axis varies fastest.
     */
    public int[] shape() {
        return shape.clone();
    }

    int shapeLength() {
        return shape.length;
    }

    void setAxisExtent(int axis, int extent) {
        shape[axis - 1] = extent;
    }

    /**
     * @return The value of {@code PCOUNT}, which is 0 if it was not given.
     */
    public long parameterCount() {
        return parameterCount;
    }

    void setParameterCount(long parameterCount) {
        this.parameterCount = parameterCount;
    }

    /**
     * @return The value of {@code GCOUNT}, which is 1 if it was not given.
     */
    public long groupCount() {
        return groupCount;
    }

    void setGroupCount(long groupCount) {
        this.groupCount = groupCount;
    }

    /**
     * @param parameter
     *     The 1-based index of the group parameter.
     *
     * @return The value of {@code PSCALn}, which is 1.0 if it was not given.
     */
    public double parameterScale(int parameter) {
        return parameterScales.getOrDefault(parameter, 1.0);
    }

    void setParameterScale(int parameter, double scale) {
        parameterScales.put(parameter, scale);
    }

    /**
     * @param parameter
     *     The 1-based index of the group parameter.
     *
     * @return The value of {@code PZEROn}, which is 0.0 if it was not given.
     */
    public double parameterZero(int parameter) {
        return parameterZeros.getOrDefault(parameter, 0.0);
    }

    void setParameterZero(int parameter, double zero) {
        parameterZeros.put(parameter, zero);
    }

    /**
     * @return The value of {@code TFIELDS}, or {@link #UNSET} if it was not given.
     */
    public int fieldCount() {
        return fieldCount;
    }

    /**
     * Sets the number of fields in a table row, which discards any per-field values that had been set.
     *
     * @param fieldCount
     *     The number of fields.
     */
    void setFieldCount(int fieldCount) {
        assert 0 <= fieldCount && fieldCount <= MAX_FIELDS : "fieldCount out of range";
        this.fieldCount = fieldCount;
        columnStarts = new int[fieldCount];
        fieldFormats = new String[fieldCount];
        fieldScales = new double[fieldCount];
        Arrays.fill(fieldScales, 1.0);
        fieldZeros = new double[fieldCount];
        fieldNulls = new String[fieldCount];
        fieldDisplayFormats = new String[fieldCount];
    }

    /**
     * @param field
     *     The 1-based index of the field.
     *
     * @return The value of {@code TBCOLn}, the 1-based column at which the field starts, or 0 if it was not given.
     */
    public int columnStart(int field) {
        return columnStarts[field - 1];
    }

    void setColumnStart(int field, int column) {
        columnStarts[field - 1] = column;
    }

    /**
     * @param field
     *     The 1-based index of the field.
     *
     * @return The unquoted value of {@code TFORMn}, or {@code null} if it was not given.
     */
    public String fieldFormat(int field) {
        return fieldFormats[field - 1];
    }

    void setFieldFormat(int field, String format) {
        fieldFormats[field - 1] = format;
    }

    /**
     * @param field
     *     The 1-based index of the field.
     *
     * @return The value of {@code TSCALn}, which is 1.0 if it was not given.
     */
    public double fieldScale(int field) {
        return fieldScales[field - 1];
    }

    void setFieldScale(int field, double scale) {
        fieldScales[field - 1] = scale;
    }

    /**
     * @param field
     *     The 1-based index of the field.
     *
     * @return The value of {@code TZEROn}, which is 0.0 if it was not given.
     */
    public double fieldZero(int field) {
        return fieldZeros[field - 1];
    }

    void setFieldZero(int field, double zero) {
        fieldZeros[field - 1] = zero;
    }

    /**
     * @param field
     *     The 1-based index of the field.
     *
     * @return The unquoted value of {@code TNULLn}, or {@code null} if it was not given.
     */
    public String fieldNull(int field) {
        return fieldNulls[field - 1];
    }

    void setFieldNull(int field, String nullValue) {
        fieldNulls[field - 1] = nullValue;
    }

    /**
     * @param field
     *     The 1-based index of the field.
     *
     * @return The unquoted value of {@code TDISPn}, or {@code null} if it was not given.
     */
    public String fieldDisplayFormat(int field) {
        return fieldDisplayFormats[field - 1];
    }

    void setFieldDisplayFormat(int field, String displayFormat) {
        fieldDisplayFormats[field - 1] = displayFormat;
    }

    /**
     * @return The value of {@code THEAP}, or {@link #UNSET} if it was not given.
     */
    public long heapOffset() {
        return heapOffset;
    }

    void setHeapOffset(long heapOffset) {
        this.heapOffset = heapOffset;
    }
}
