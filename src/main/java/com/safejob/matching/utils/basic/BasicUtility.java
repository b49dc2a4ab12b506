package com.safejob.matching.utils.basic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.safejob.matching.exceptions.InternalServerErrorException;

import java.nio.charset.StandardCharsets;
import java.util.UUID;


public final class BasicUtility {
    private static final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private BasicUtility() {
        throw new UnsupportedOperationException("Not supported");
    }

    public static String stringifyObject(Object o) {
        try {
            return om.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new InternalServerErrorException("Failed stringifying " + o.getClass().getSimpleName(), e);
        }
    }

    /**
     * Order-independent identifier for a pair of candidates; the same two ids always give the same couple id.
     */
    public static UUID coupleId(UUID first, UUID second) {
        boolean ordered = first.compareTo(second) <= 0;
        UUID low = ordered ? first : second;
        UUID high = ordered ? second : first;
        return UUID.nameUUIDFromBytes((low + ":" + high).getBytes(StandardCharsets.UTF_8));
    }
}
