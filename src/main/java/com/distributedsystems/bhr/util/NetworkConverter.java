package com.distributedsystems.bhr.util;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores a {@link Network} as its canonical text so equality lookups and the unique
 * active-network constraint work on plain string comparison.
 */
@Converter
public class NetworkConverter implements AttributeConverter<Network, String> {

    @Override
    public String convertToDatabaseColumn(Network network) {
        return network == null ? null : network.toText();
    }

    @Override
    public Network convertToEntityAttribute(String text) {
        return text == null ? null : Network.parse(text);
    }
}
