package gr.imsi.athenarc.uroflow.cli;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;

public class LocalDateConverter implements IStringConverter<LocalDate> {
    @Override
    public LocalDate convert(String value) {
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ParameterException("Expected a date as yyyy-MM-dd but got " + value);
        }
    }
}
