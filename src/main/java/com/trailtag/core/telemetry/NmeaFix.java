package com.trailtag.core.telemetry;

import com.trailtag.core.error.ParseException;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Позиция из одного NMEA-предложения (RMC, GGA или GLL).
 * date есть только у RMC, course только у RMC, alt только у GGA.
 */
public record NmeaFix(String type, LocalDate date, LocalTime time, double lat, double lon, Double alt, Double course) {

    /** null если предложение не несёт валидной позиции. */
    public static NmeaFix of(NmeaSentence s) throws ParseException {
        switch (s.type()) {
            case "RMC":
                return rmc(s);
            case "GGA":
                return gga(s);
            case "GLL":
                return gll(s);
            default:
                return null;
        }
    }

    // RMC: time,status,lat,N/S,lon,E/W,speed,course,date,...
    private static NmeaFix rmc(NmeaSentence s) throws ParseException {
        if (!"A".equalsIgnoreCase(s.field(1))) {
            return null;
        }
        Double lat = s.coordinate(2, 3);
        Double lon = s.coordinate(4, 5);
        if (lat == null || lon == null) {
            return null;
        }
        return new NmeaFix("RMC", s.date(8), s.time(0), lat, lon, null, s.number(7));
    }

    // GGA: time,lat,N/S,lon,E/W,quality,sats,hdop,alt,M,...
    private static NmeaFix gga(NmeaSentence s) throws ParseException {
        Double quality = s.number(5);
        if (quality == null || quality < 1) {
            return null;
        }
        Double lat = s.coordinate(1, 2);
        Double lon = s.coordinate(3, 4);
        if (lat == null || lon == null) {
            return null;
        }
        return new NmeaFix("GGA", null, s.time(0), lat, lon, s.number(8), null);
    }

    // GLL: lat,N/S,lon,E/W,time,status
    private static NmeaFix gll(NmeaSentence s) throws ParseException {
        if (!s.isEmpty(5) && !"A".equalsIgnoreCase(s.field(5))) {
            return null;
        }
        Double lat = s.coordinate(0, 1);
        Double lon = s.coordinate(2, 3);
        if (lat == null || lon == null) {
            return null;
        }
        return new NmeaFix("GLL", null, s.time(4), lat, lon, null, null);
    }
}
