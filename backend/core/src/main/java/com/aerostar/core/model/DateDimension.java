package com.aerostar.core.model;

import java.time.LocalDate;
import java.util.List;

public record DateDimension(
        int idDate,
        LocalDate date,
        int year,
        int month,
        int day,
        int dayOfYear
) {
    public static final String TABLE = "Dim_Date";
    public static final List<String> COLUMNS = List.of("id_date", "Date", "Year", "Month", "Day", "Day_of_Year");

    public static DateDimension of(int idDate, LocalDate date) {
        return new DateDimension(idDate, date, date.getYear(), date.getMonthValue(), date.getDayOfMonth(), date.getDayOfYear());
    }
}
