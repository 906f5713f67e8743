package com.example.alertengine.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.Map;

@Converter
public class SeverityOverridesConverter extends JsonAttributeConverter<Map<String, String>> {

    public SeverityOverridesConverter() {
        super(new TypeReference<>() {});
    }
}
