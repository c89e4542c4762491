package com.beerpong.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link TournamentType} as the lowercase literal the schema CHECK constraint expects.
 */
@Converter
public class TournamentTypeConverter implements AttributeConverter<TournamentType, String> {

    @Override
    public String convertToDatabaseColumn(TournamentType attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public TournamentType convertToEntityAttribute(String dbData) {
        return dbData != null ? TournamentType.fromValue(dbData) : null;
    }
}
