package com.instaclustr.bulkrestore.measure;

import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

public class TimeMeasureTypeConverter implements ITypeConverter<Time> {

    @Override
    public Time convert(final String value) {
        try {
            return Time.parse(value);
        } catch (final IllegalArgumentException ex) {
            throw new TypeConversionException(ex.getMessage());
        }
    }
}
