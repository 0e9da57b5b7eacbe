package hwelab.core;

import hwelab.ir.Width;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Aggregate of named fields. Field order is construction order; it defines the order of {@link #flatten()}.
 * Fields can only be added while the record is unbound.
 */
public class Record extends Data {
  private final LinkedHashMap<String, Data> fields = new LinkedHashMap<>();
  private boolean isField = false;

  /**
   * Appends a field.
   * @param fieldName the field name, unique within this record
   * @param data an unbound value not yet used in another record
   * @return this
   */
  public Record field(String fieldName, Data data) {
    if (isBound())
      throw new IllegalStateException("Cannot add field '" + fieldName + "' to bound record " + this);
    if (fields.containsKey(fieldName))
      throw new IllegalArgumentException("Duplicate field '" + fieldName + "'");
    if (data.isBound() || data.isLit())
      throw new IllegalArgumentException("Field '" + fieldName + "' must be an unbound type, got " + data);
    if (data instanceof Record) {
      if (((Record)data).isField)
        throw new IllegalArgumentException("Field '" + fieldName + "' is already part of another record");
      ((Record)data).isField = true;
    } else if (fields.containsValue(data)) {
      throw new IllegalArgumentException("Field '" + fieldName + "' is already in use");
    }
    fields.put(fieldName, data);
    return this;
  }

  /** Returns the field of the given name; throws NoSuchElementException if missing. */
  public Data get(String fieldName) {
    Data ret = fields.get(fieldName);
    if (ret == null)
      throw new java.util.NoSuchElementException("Record " + typeString() + " has no field '" + fieldName + "'");
    return ret;
  }

  /** Returns a leaf field; throws ClassCastException if the field is an aggregate. */
  public Element getElement(String fieldName) { return (Element)get(fieldName); }

  public Map<String, Data> getFields() { return Collections.unmodifiableMap(fields); }

  @Override
  void setBinding(Binding binding) {
    super.setBinding(binding);
    for (Data field : fields.values())
      field.setBinding(binding);
  }

  @Override
  public Record suggestName(String name) {
    super.suggestName(name);
    fields.forEach((fieldName, field) -> field.suggestName(name + "." + fieldName));
    return this;
  }

  @Override
  public List<Element> flatten() {
    List<Element> ret = new ArrayList<>();
    for (Data field : fields.values())
      ret.addAll(field.flatten());
    return ret;
  }

  @Override
  public Record cloneType() {
    Record ret = new Record();
    fields.forEach((fieldName, field) -> ret.field(fieldName, field.cloneType()));
    return ret;
  }

  @Override
  public Width getWidth() {
    return fields.values().stream().map(Data::getWidth).reduce(Width.known(0), Width::plus);
  }

  @Override
  public String typeString() {
    return fields.entrySet()
        .stream()
        .map(entry -> entry.getKey() + ": " + entry.getValue().typeString())
        .collect(Collectors.joining(", ", "{", "}"));
  }
}
