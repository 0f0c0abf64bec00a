package com.ospicorp.filingmetrics.analysis.controller;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.StringJoiner;
import org.springframework.core.ResolvableType;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractGenericHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * Writes collections of flat rows as {@code text/csv}, one column per property of the element
 * type and a header line. The columns come from the declared element type, so an empty
 * collection still renders its header.
 */
public class CsvHttpMessageConverter extends AbstractGenericHttpMessageConverter<Collection<?>> {
  public static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");

  private final CsvMapper mapper = new CsvMapper();

  public CsvHttpMessageConverter() {
    super(TEXT_CSV);
    mapper.findAndRegisterModules();
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return Collection.class.isAssignableFrom(clazz);
  }

  @Override
  public boolean canRead(@NonNull Type type, @Nullable Class<?> contextClass,
      @Nullable MediaType mediaType) {
    return false;
  }

  @Override
  @NonNull
  public Collection<?> read(@NonNull Type type, @Nullable Class<?> contextClass,
      @NonNull HttpInputMessage inputMessage) throws IOException, HttpMessageNotReadableException {
    throw new HttpMessageNotReadableException("CSV reading not supported", inputMessage);
  }

  @Override
  @NonNull
  protected Collection<?> readInternal(@NonNull Class<? extends Collection<?>> clazz,
      @NonNull HttpInputMessage inputMessage) throws IOException, HttpMessageNotReadableException {
    throw new HttpMessageNotReadableException("CSV reading not supported", inputMessage);
  }

  @Override
  protected void writeInternal(@NonNull Collection<?> rows, @Nullable Type type,
      @NonNull HttpOutputMessage outputMessage) throws IOException, HttpMessageNotWritableException {
    Class<?> rowType = rowType(rows, type);
    if (rowType == null) {
      return;
    }
    CsvSchema schema = mapper.schemaFor(rowType).withHeader();
    if (rows.stream().allMatch(r -> r == null)) {
      outputMessage.getBody().write(headerLine(schema).getBytes(StandardCharsets.UTF_8));
      outputMessage.getBody().flush();
      return;
    }
    var writer = mapper.writer(schema).writeValues(outputMessage.getBody());
    for (Object row : rows) {
      if (row != null) {
        writer.write(row);
      }
    }
    writer.flush();
  }

  private static String headerLine(CsvSchema schema) {
    StringJoiner header = new StringJoiner(String.valueOf(schema.getColumnSeparator()));
    for (CsvSchema.Column column : schema) {
      header.add(column.getName());
    }
    return header + new String(schema.getLineSeparator());
  }

  // Declared element type first; the first row's class when the declaration is raw.
  @Nullable
  static Class<?> rowType(Collection<?> rows, @Nullable Type type) {
    Class<?> declared = ResolvableType.forType(type).asCollection().resolveGeneric(0);
    if (declared != null && declared != Object.class) {
      return declared;
    }
    return rows.stream().filter(r -> r != null).findFirst().map(Object::getClass).orElse(null);
  }
}
