package io.b2mash.orgaccess.membership;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class MembershipLevelConverter implements AttributeConverter<MembershipLevel, Short> {

  @Override
  public Short convertToDatabaseColumn(MembershipLevel level) {
    return level == null ? null : (short) level.value();
  }

  @Override
  public MembershipLevel convertToEntityAttribute(Short value) {
    return value == null ? null : MembershipLevel.fromValue(value);
  }
}
