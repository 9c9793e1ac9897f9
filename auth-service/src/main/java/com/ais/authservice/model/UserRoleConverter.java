package com.ais.authservice.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

// Stores the lowercase code, not the enum name, so the other backend reads the same values.
@Converter(autoApply = true)
public class UserRoleConverter implements AttributeConverter<UserRole, String> {

    @Override
    public String convertToDatabaseColumn(UserRole role) {
        return role != null ? role.getCode() : null;
    }

    @Override
    public UserRole convertToEntityAttribute(String code) {
        return code != null ? UserRole.fromCode(code) : null;
    }
}
