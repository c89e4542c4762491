package com.beerpong.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class PlacementRankConverter implements AttributeConverter<PlacementRank, Integer> {

    @Override
    public Integer convertToDatabaseColumn(PlacementRank attribute) {
        return attribute != null ? attribute.getRank() : null;
    }

    @Override
    public PlacementRank convertToEntityAttribute(Integer dbData) {
        return dbData != null ? PlacementRank.fromRank(dbData) : null;
    }
}
