package io.b2mash.ledgerbooks.security;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Stores {@link OrgRole} as its lowercase value ({@code owner}, {@code admin}, {@code member}). */
@Converter(autoApply = true)
public class OrgRoleConverter implements AttributeConverter<OrgRole, String> {

  @Override
  public String convertToDatabaseColumn(OrgRole role) {
    return role != null ? role.value() : null;
  }

  @Override
  public OrgRole convertToEntityAttribute(String value) {
    return value != null ? OrgRole.fromValue(value) : null;
  }
}
