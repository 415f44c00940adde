package io.b2mash.b2b.dynamicfields.dynamicfield;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.b2b.dynamicfields.exception.FieldValidationException;
import java.util.Arrays;
import java.util.List;

/** Objects that can carry dynamic field values. */
public enum ObjectType {
  TICKET("Ticket", "DynamicField_"),
  ARTICLE("Article", "ArticleDynamicField_"),
  CUSTOMER_USER("CustomerUser", "CustomerUserDynamicField_"),
  CUSTOMER_COMPANY("CustomerCompany", "CustomerCompanyDynamicField_");

  private final String externalName;
  private final String formPrefix;

  ObjectType(String externalName, String formPrefix) {
    this.externalName = externalName;
    this.formPrefix = formPrefix;
  }

  @JsonValue
  public String externalName() {
    return externalName;
  }

  /** Prefix of posted form keys carrying values of this object's fields. */
  public String formPrefix() {
    return formPrefix;
  }

  public static List<String> externalNames() {
    return Arrays.stream(values()).map(ObjectType::externalName).toList();
  }

  @JsonCreator
  public static ObjectType fromExternalName(String name) {
    if (name != null) {
      for (var type : values()) {
        if (type.externalName.equals(name) || type.name().equalsIgnoreCase(name)) {
          return type;
        }
      }
    }
    throw new FieldValidationException(
        "objectType", "Invalid object type: " + name + ". Expected one of " + externalNames());
  }
}
