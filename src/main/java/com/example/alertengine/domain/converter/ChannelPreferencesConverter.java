package com.example.alertengine.domain.converter;

import com.example.alertengine.domain.ChannelPreference;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.Map;

@Converter
public class ChannelPreferencesConverter extends JsonAttributeConverter<Map<String, ChannelPreference>> {

    public ChannelPreferencesConverter() {
        super(new TypeReference<>() {});
    }
}
