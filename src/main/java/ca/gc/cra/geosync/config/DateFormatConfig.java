package ca.gc.cra.geosync.config;

import ca.gc.cra.geosync.validation.Strings;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * Date columns of a source and the patterns used to rewrite them.
 *
 * <p>Patterns follow {@link DateTimeFormatter#ofPattern(String)}; an invalid pattern is rejected when the
 * configuration is built, not when the first value is converted.</p>
 *
 * @param columns columns holding dates, named as they are stored
 * @param inFormat pattern of the published values, e.g. {@code dd.MM.yyyy}
 * @param outFormat pattern of the stored values, e.g. {@code yyyy-MM-dd}
 * @since 0.1.0
 */
public record DateFormatConfig(List<String> columns, String inFormat, String outFormat) {

  public DateFormatConfig {
    columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    if (columns.isEmpty()) {
      throw new IllegalArgumentException("date columns must not be empty");
    }
    inFormat = Strings.requireNonBlank("inFormat", inFormat);
    outFormat = Strings.requireNonBlank("outFormat", outFormat);
    DateTimeFormatter.ofPattern(inFormat);
    DateTimeFormatter.ofPattern(outFormat);
  }

  public DateTimeFormatter inFormatter() {
    return DateTimeFormatter.ofPattern(inFormat);
  }

  public DateTimeFormatter outFormatter() {
    return DateTimeFormatter.ofPattern(outFormat);
  }
}
