package com.example.alertengine.domain.converter;

import com.example.alertengine.domain.AutoResolutionPolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.Map;

@Converter
public class AutoResolutionConverter extends JsonAttributeConverter<Map<String, AutoResolutionPolicy>> {

    public AutoResolutionConverter() {
        super(new TypeReference<>() {});
    }
}
