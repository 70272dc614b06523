/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.biosignal.archiver.common;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Timestamps in the archiver are epoch milliseconds as sent by the devices.
 * Sessions carry Instants.
 * This class contains utilities to convert between these and to format them as ISO 8601 strings.
 * @author mshankar
 *
 */
public class TimeUtils {
    private static final String ISO_DATE_MILLIS_FORMAT = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'";

    public static Instant convertFromEpochMillis(long epochMillis) {
        return Instant.ofEpochMilli(epochMillis);
    }

    public static Instant convertFromISO8601String(String tsstr) {
        // Sample ISO8601 string 2011-02-01T08:00:00.000Z
        return Instant.parse(tsstr);
    }

    public static String convertToISO8601String(Instant ts) {
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern(ISO_DATE_MILLIS_FORMAT);
        ZonedDateTime truncTs = ts.truncatedTo(ChronoUnit.MILLIS).atZone(ZoneId.from(ZoneOffset.UTC));
        return formatter.format(truncTs);
    }

    public static String convertToISO8601String(long epochMillis) {
        return convertToISO8601String(Instant.ofEpochMilli(epochMillis));
    }

    public static Instant now() {
        return Instant.now();
    }
}
