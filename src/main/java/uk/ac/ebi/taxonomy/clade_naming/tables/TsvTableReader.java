package uk.ac.ebi.taxonomy.clade_naming.tables;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;
import uk.ac.ebi.taxonomy.clade_naming.exceptions.MalformedTableException;

/**
 * Reads tab-separated tables with Jackson's CSV module. Fields are never quoted.
 */
@Component
public class TsvTableReader {

  private static final char TAB = '\t';

  private final CsvMapper mapper =
      CsvMapper.builder()
          .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
          .enable(CsvParser.Feature.TRIM_SPACES)
          .build();

  private final CsvMapper arrayMapper =
      CsvMapper.builder()
          .enable(CsvParser.Feature.WRAP_AS_ARRAY)
          .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
          .enable(CsvParser.Feature.TRIM_SPACES)
          .build();

  /**
   * Reads a table whose first line is a header, one map per row keyed by column name.
   *
   * @param path the table
   * @param requiredColumns columns the header must contain
   * @throws MalformedTableException if the table cannot be parsed or lacks a required column
   */
  public List<Map<String, String>> readWithHeader(Path path, Collection<String> requiredColumns) {
    CsvSchema schema =
        CsvSchema.emptySchema().withHeader().withColumnSeparator(TAB).withoutQuoteChar();
    try (MappingIterator<Map<String, String>> rows =
        mapper.readerForMapOf(String.class).with(schema).readValues(path.toFile())) {
      List<Map<String, String>> all = rows.readAll();
      CsvSchema header = (CsvSchema) rows.getParserSchema();
      for (String column : requiredColumns) {
        if (header == null || header.column(column) == null) {
          throw new MalformedTableException(path + " is missing column '" + column + "'");
        }
      }
      return all;
    } catch (IOException | RuntimeException e) {
      throw asMalformed(path, e);
    }
  }

  /**
   * Reads a headerless table, one list of fields per row.
   *
   * @throws MalformedTableException if the table cannot be parsed
   */
  public List<List<String>> readWithoutHeader(Path path) {
    CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(TAB).withoutQuoteChar();
    try (MappingIterator<List<String>> rows =
        arrayMapper.readerForListOf(String.class).with(schema).readValues(path.toFile())) {
      return rows.readAll();
    } catch (IOException | RuntimeException e) {
      throw asMalformed(path, e);
    }
  }

  private static MalformedTableException asMalformed(Path path, Exception e) {
    if (e instanceof MalformedTableException malformed) {
      return malformed;
    }
    if (!Files.isReadable(path)) {
      return new MalformedTableException("Cannot read table " + path, e);
    }
    return new MalformedTableException("Cannot parse table " + path + ": " + e.getMessage(), e);
  }
}
