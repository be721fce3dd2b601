package com.example.cruscotto.infrastructure.parquet;

import com.example.cruscotto.domain.model.ColumnSpec;
import com.example.cruscotto.domain.model.DatasetType;
import com.example.cruscotto.domain.model.TableMetadata;
import com.example.cruscotto.infrastructure.exception.ColumnarStoreException;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.util.Utf8;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.hadoop.metadata.FileMetaData;
import org.apache.parquet.hadoop.util.HadoopInputFile;
import org.apache.parquet.hadoop.util.HadoopOutputFile;
import org.apache.parquet.schema.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes one Parquet file per dataset through the Avro object model.
 * <p>
 * Files are written next to their final location under a temporary name and moved into place, so
 * readers never observe a partially written table. The footer carries the dataset name, the row
 * count and the reference-date range so that metadata can be served without reading rows.
 */
@Component
public class ParquetTableStore {

    public static final String EXTENSION = ".parquet";
    static final String META_DATASET = "cruscotto.dataset";
    static final String META_ROW_COUNT = "cruscotto.row_count";
    static final String META_MIN_DATE = "cruscotto.min_reference_date";
    static final String META_MAX_DATE = "cruscotto.max_reference_date";

    private static final Logger log = LoggerFactory.getLogger(ParquetTableStore.class);

    private final Configuration conf;

    public ParquetTableStore() {
        this.conf = new Configuration();
        this.conf.setBoolean("fs.file.impl.disable.cache", true);
    }

    /**
     * Avro schema for a dataset: non-null columns in catalogue order.
     */
    public static Schema schemaFor(DatasetType dataset) {
        SchemaBuilder.FieldAssembler<Schema> fields = SchemaBuilder.record(dataset.tableName())
                .namespace("com.example.cruscotto")
                .fields();
        for (ColumnSpec column : dataset.columns()) {
            switch (column.type()) {
                case INT -> fields = fields.name(column.name()).type().intType().noDefault();
                case STRING -> fields = fields.name(column.name()).type().stringType().noDefault();
                default -> throw new IllegalStateException("Unsupported column type " + column.type());
            }
        }
        return fields.endRecord();
    }

    /**
     * Replaces the table file of {@code dataset} in {@code directory} with {@code rows}.
     *
     * @param rows rows keyed by column name; missing measures are written as zero
     * @return path of the written table
     * @throws ColumnarStoreException when the file cannot be written
     */
    public Path write(Path directory, DatasetType dataset, List<Map<String, Object>> rows) {
        Path target = directory.resolve(dataset.tableName() + EXTENSION);
        Schema schema = schemaFor(dataset);
        Path temp = directory.resolve("." + dataset.tableName() + "-" + System.nanoTime() + EXTENSION + ".tmp");
        try {
            Files.createDirectories(directory);
            try (ParquetWriter<GenericRecord> writer = AvroParquetWriter
                    .<GenericRecord>builder(HadoopOutputFile.fromPath(new org.apache.hadoop.fs.Path(temp.toUri()), conf))
                    .withSchema(schema)
                    .withConf(conf)
                    .withCompressionCodec(CompressionCodecName.SNAPPY)
                    .withExtraMetaData(footer(dataset, rows))
                    .build()) {
                for (Map<String, Object> row : rows) {
                    writer.write(toRecord(schema, dataset, row));
                }
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Wrote {} rows to {}", rows.size(), target);
            return target;
        } catch (IOException | RuntimeException ex) {
            throw new ColumnarStoreException("Failed to write table " + dataset.tableName(), ex);
        } finally {
            deleteQuietly(temp);
            deleteQuietly(checksumOf(temp));
        }
    }

    /**
     * Loads every row of a table file. Strings are returned as {@link String}, integers as {@link Integer}.
     *
     * @throws ColumnarStoreException when the file cannot be read
     */
    public List<Map<String, Object>> read(Path file) {
        List<Map<String, Object>> rows = new ArrayList<>();
        try (ParquetReader<GenericRecord> reader = AvroParquetReader
                .<GenericRecord>builder(HadoopInputFile.fromPath(new org.apache.hadoop.fs.Path(file.toUri()), conf))
                .withConf(conf)
                .build()) {
            GenericRecord record;
            while ((record = reader.read()) != null) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (Schema.Field field : record.getSchema().getFields()) {
                    Object value = record.get(field.name());
                    row.put(field.name(), value instanceof Utf8 || value instanceof CharSequence ? value.toString() : value);
                }
                rows.add(row);
            }
            return rows;
        } catch (IOException | RuntimeException ex) {
            throw new ColumnarStoreException("Failed to read table " + file.getFileName(), ex);
        }
    }

    /**
     * Reads the footer only.
     *
     * @throws ColumnarStoreException when the footer cannot be read
     */
    public TableMetadata readMetadata(Path file) {
        String name = tableName(file);
        try (ParquetFileReader reader = ParquetFileReader.open(
                HadoopInputFile.fromPath(new org.apache.hadoop.fs.Path(file.toUri()), conf))) {
            FileMetaData footer = reader.getFooter().getFileMetaData();
            List<String> columns = footer.getSchema().getFields().stream().map(Type::getName).toList();
            Map<String, String> extra = footer.getKeyValueMetaData();
            return new TableMetadata(
                    name,
                    file,
                    columns,
                    Files.size(file),
                    Files.getLastModifiedTime(file).toInstant(),
                    reader.getRecordCount(),
                    extra.get(META_MIN_DATE),
                    extra.get(META_MAX_DATE));
        } catch (IOException | RuntimeException ex) {
            throw new ColumnarStoreException("Failed to read metadata of table " + name, ex);
        }
    }

    public static String tableName(Path file) {
        String filename = file.getFileName().toString();
        return filename.endsWith(EXTENSION) ? filename.substring(0, filename.length() - EXTENSION.length()) : filename;
    }

    private static Map<String, String> footer(DatasetType dataset, List<Map<String, Object>> rows) {
        Map<String, String> meta = new HashMap<>();
        meta.put(META_DATASET, dataset.tableName());
        meta.put(META_ROW_COUNT, Integer.toString(rows.size()));
        String min = null;
        String max = null;
        for (Map<String, Object> row : rows) {
            Object value = row.get(DatasetType.REFERENCE_DATE);
            if (value == null) {
                continue;
            }
            String date = value.toString();
            if (min == null || date.compareTo(min) < 0) {
                min = date;
            }
            if (max == null || date.compareTo(max) > 0) {
                max = date;
            }
        }
        if (min != null) {
            meta.put(META_MIN_DATE, min);
            meta.put(META_MAX_DATE, max);
        }
        return meta;
    }

    private static GenericRecord toRecord(Schema schema, DatasetType dataset, Map<String, Object> row) {
        GenericData.Record record = new GenericData.Record(schema);
        for (ColumnSpec column : dataset.columns()) {
            Object value = row.get(column.name());
            if (column.numeric()) {
                record.put(column.name(), value instanceof Number number ? number.intValue() : parseInt(value));
            } else {
                record.put(column.name(), value == null ? "" : value.toString());
            }
        }
        return record;
    }

    private static int parseInt(Object value) {
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException ex) {
            return 0;
        }
    }

    private static Path checksumOf(Path file) {
        return file.resolveSibling("." + file.getFileName() + ".crc");
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.warn("Could not delete temporary file {}: {}", path, ex.getMessage());
        }
    }
}
