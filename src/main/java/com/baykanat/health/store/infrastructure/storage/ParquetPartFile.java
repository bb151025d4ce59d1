package com.baykanat.health.store.infrastructure.storage;

import org.apache.avro.Schema;
import org.apache.avro.Schema.Field;
import org.apache.avro.Schema.Type;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.io.LocalOutputFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Tek kayıtlık part dosyaları için parquet-avro okuma/yazma. Şema her dosyada sütunlardan türetilir. */
public final class ParquetPartFile {

    private static final String RECORD_NAME = "HealthRecord";
    private static final String RECORD_NAMESPACE = "com.baykanat.health.store";

    private ParquetPartFile() {
    }

    /** Dosyayı CREATE_NEW ile yazar; var olan dosyanın üzerine yazmaz. */
    public static void write(Path file, Map<String, Object> columns, CompressionCodecName codec) throws IOException {
        Schema schema = schemaOf(columns);
        GenericRecord record = new GenericData.Record(schema);
        columns.forEach(record::put);

        try (ParquetWriter<GenericRecord> writer = AvroParquetWriter.<GenericRecord>builder(new LocalOutputFile(file))
                .withSchema(schema)
                .withDataModel(GenericData.get())
                .withCompressionCodec(codec)
                .withWriteMode(ParquetFileWriter.Mode.CREATE)
                .build()) {
            writer.write(record);
        }
    }

    /** Tüm satırları dosyadaki sütun sırasıyla okur; NaN değerler null olur. */
    public static List<Map<String, Object>> read(Path file) throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>();
        try (ParquetReader<GenericRecord> reader = openReader(file)) {
            GenericRecord record;
            while ((record = reader.read()) != null) {
                rows.add(toRow(record));
            }
        }
        return rows;
    }

    /** Footer'a bakmadan tam okuma ile satır sayısı. */
    public static long countRows(Path file) throws IOException {
        long count = 0;
        try (ParquetReader<GenericRecord> reader = openReader(file)) {
            while (reader.read() != null) {
                count++;
            }
        }
        return count;
    }

    private static ParquetReader<GenericRecord> openReader(Path file) throws IOException {
        return AvroParquetReader.<GenericRecord>builder(new NioInputFile(file))
                .withDataModel(GenericData.get())
                .build();
    }

    static Schema schemaOf(Map<String, Object> columns) {
        List<Field> fields = new ArrayList<>(columns.size());
        columns.forEach((name, value) ->
                fields.add(new Field(name, nullable(Schema.create(avroType(name, value))), null,
                        Field.NULL_DEFAULT_VALUE)));
        Schema schema = Schema.createRecord(RECORD_NAME, null, RECORD_NAMESPACE, false);
        schema.setFields(fields);
        return schema;
    }

    private static Schema nullable(Schema schema) {
        return Schema.createUnion(List.of(Schema.create(Type.NULL), schema));
    }

    private static Type avroType(String name, Object value) {
        if (value instanceof Integer) {
            return Type.INT;
        }
        if (value instanceof Long) {
            return Type.LONG;
        }
        if (value instanceof Double) {
            return Type.DOUBLE;
        }
        if (value instanceof Float) {
            return Type.FLOAT;
        }
        if (value instanceof Boolean) {
            return Type.BOOLEAN;
        }
        if (value instanceof CharSequence) {
            return Type.STRING;
        }
        throw new IllegalArgumentException("Unsupported column type for '" + name + "': "
                + (value == null ? "null" : value.getClass().getName()));
    }

    private static Map<String, Object> toRow(GenericRecord record) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (Field field : record.getSchema().getFields()) {
            row.put(field.name(), fromAvroValue(record.get(field.pos())));
        }
        return row;
    }

    private static Object fromAvroValue(Object value) {
        if (value == null) {
            return null;
        }
        // Avro string'leri Utf8 olarak döner
        if (value instanceof CharSequence) {
            return value.toString();
        }
        if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
            return null;
        }
        if (value instanceof Float f && (f.isNaN() || f.isInfinite())) {
            return null;
        }
        return value;
    }
}
