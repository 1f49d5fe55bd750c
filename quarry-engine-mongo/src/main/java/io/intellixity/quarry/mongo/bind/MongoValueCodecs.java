package io.intellixity.quarry.mongo.bind;

import io.intellixity.quarry.model.FieldType;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.*;
import java.time.temporal.ChronoUnit;
import java.util.*;

/** Codecs for every scalar {@link FieldType.Kind}; list types are handled element-wise by the operator table. */
public final class MongoValueCodecs {
  private static final Logger log = LoggerFactory.getLogger(MongoValueCodecs.class);

  private MongoValueCodecs() {}

  public static Map<FieldType.Kind, MongoValueCodec> defaults() {
    Map<FieldType.Kind, MongoValueCodec> m = new EnumMap<>(FieldType.Kind.class);
    for (MongoValueCodec c : List.of(
        new IdCodec(),
        new TextCodec(),
        new IntegerCodec(),
        new LongCodec(),
        new FloatCodec(),
        new DecimalCodec(),
        new BooleanCodec(),
        new DateTimeCodec(),
        new DateCodec(),
        new UuidCodec(),
        new DocumentCodec())) {
      m.put(c.kind(), c);
    }
    return m;
  }

  /** 24-hex strings become ObjectIds; other identifiers are stored as given. Decodes to the hex string. */
  static final class IdCodec implements MongoValueCodec {
    @Override public FieldType.Kind kind() { return FieldType.Kind.ID; }

    @Override
    public Object coerce(Object v) {
      if (v == null || v instanceof ObjectId) return v;
      if (v instanceof UUID u) return u.toString();
      if (v instanceof String s) {
        if (ObjectId.isValid(s)) return new ObjectId(s);
        if (log.isDebugEnabled()) log.debug("quarry.mongo op=coerce kind=id fallback=string len={}", s.length());
        return s;
      }
      if (v instanceof Integer || v instanceof Long) return v;
      throw new IllegalArgumentException("Cannot use " + v.getClass().getName() + " as an identifier");
    }

    @Override
    public Object decoerce(Object raw) {
      if (raw == null) return null;
      if (raw instanceof ObjectId oid) return oid.toHexString();
      if (raw instanceof String || raw instanceof Number) return String.valueOf(raw);
      if (raw instanceof UUID u) return u.toString();
      throw new IllegalArgumentException("Unexpected identifier value of type " + raw.getClass().getName());
    }
  }

  static final class TextCodec implements MongoValueCodec {
    @Override public FieldType.Kind kind() { return FieldType.Kind.TEXT; }

    @Override
    public Object coerce(Object v) {
      if (v == null || v instanceof String) return v;
      if (v instanceof CharSequence cs) return cs.toString();
      if (v instanceof Enum<?> e) return e.name();
      if (v instanceof Character c) return c.toString();
      throw new IllegalArgumentException("Cannot use " + v.getClass().getName() + " as text");
    }

    @Override
    public Object decoerce(Object raw) {
      if (raw == null || raw instanceof String) return raw;
      if (raw instanceof ObjectId oid) return oid.toHexString();
      if (raw instanceof Map<?, ?> || raw instanceof Collection<?>) {
        throw new IllegalArgumentException("Expected text but got " + raw.getClass().getName());
      }
      return raw.toString();
    }
  }

  static final class IntegerCodec implements MongoValueCodec {
    @Override public FieldType.Kind kind() { return FieldType.Kind.INTEGER; }

    @Override
    public Object coerce(Object v) {
      if (v == null || v instanceof Integer) return v;
      if (v instanceof Short || v instanceof Byte) return ((Number) v).intValue();
      if (v instanceof Long l) return Math.toIntExact(l);
      throw new IllegalArgumentException("Cannot use " + v.getClass().getName() + " as an integer");
    }

    @Override
    public Object decoerce(Object raw) {
      if (raw == null || raw instanceof Integer) return raw;
      if (raw instanceof Long l) return Math.toIntExact(l);
      if (raw instanceof Double d && d == Math.rint(d)) return Math.toIntExact(d.longValue());
      throw new IllegalArgumentException("Expected an integer but got " + describe(raw));
    }
  }

  static final class LongCodec implements MongoValueCodec {
    @Override public FieldType.Kind kind() { return FieldType.Kind.LONG; }

    @Override
    public Object coerce(Object v) {
      if (v == null || v instanceof Long) return v;
      if (v instanceof Integer || v instanceof Short || v instanceof Byte) return ((Number) v).longValue();
      if (v instanceof BigInteger b) return b.longValueExact();
      throw new IllegalArgumentException("Cannot use " + v.getClass().getName() + " as a long");
    }

    @Override
    public Object decoerce(Object raw) {
      if (raw == null || raw instanceof Long) return raw;
      if (raw instanceof Integer i) return i.longValue();
      if (raw instanceof Double d && d == Math.rint(d)) return d.longValue();
      throw new IllegalArgumentException("Expected a long but got " + describe(raw));
    }
  }

  static final class FloatCodec implements MongoValueCodec {
    @Override public FieldType.Kind kind() { return FieldType.Kind.FLOAT; }

    @Override
    public Object coerce(Object v) {
      if (v == null || v instanceof Double) return v;
      if (v instanceof Number n && !(v instanceof BigDecimal)) return n.doubleValue();
      if (v instanceof BigDecimal b) return b.doubleValue();
      throw new IllegalArgumentException("Cannot use " + v.getClass().getName() + " as a float");
    }

    @Override
    public Object decoerce(Object raw) {
      if (raw == null || raw instanceof Double) return raw;
      if (raw instanceof Decimal128 d) return d.bigDecimalValue().doubleValue();
      if (raw instanceof Number n) return n.doubleValue();
      throw new IllegalArgumentException("Expected a number but got " + describe(raw));
    }
  }

  static final class DecimalCodec implements MongoValueCodec {
    @Override public FieldType.Kind kind() { return FieldType.Kind.DECIMAL; }

    @Override
    public Object coerce(Object v) {
      if (v == null || v instanceof Decimal128) return v;
      if (v instanceof BigDecimal b) return new Decimal128(b);
      if (v instanceof Integer || v instanceof Long || v instanceof BigInteger) return new Decimal128(new BigDecimal(v.toString()));
      if (v instanceof Number n) return new Decimal128(BigDecimal.valueOf(n.doubleValue()));
      if (v instanceof String s) return Decimal128.parse(s);
      throw new IllegalArgumentException("Cannot use " + v.getClass().getName() + " as a decimal");
    }

    @Override
    public Object decoerce(Object raw) {
      if (raw == null || raw instanceof BigDecimal) return raw;
      if (raw instanceof Decimal128 d) return d.bigDecimalValue();
      if (raw instanceof Integer || raw instanceof Long) return new BigDecimal(raw.toString());
      if (raw instanceof Double d) return BigDecimal.valueOf(d);
      throw new IllegalArgumentException("Expected a decimal but got " + describe(raw));
    }
  }

  static final class BooleanCodec implements MongoValueCodec {
    @Override public FieldType.Kind kind() { return FieldType.Kind.BOOLEAN; }

    @Override
    public Object coerce(Object v) {
      if (v == null || v instanceof Boolean) return v;
      throw new IllegalArgumentException("Cannot use " + v.getClass().getName() + " as a boolean");
    }

    @Override
    public Object decoerce(Object raw) {
      if (raw == null || raw instanceof Boolean) return raw;
      throw new IllegalArgumentException("Expected a boolean but got " + describe(raw));
    }
  }

  /** Instants are stored as BSON dates, so precision is cut to milliseconds. */
  static final class DateTimeCodec implements MongoValueCodec {
    @Override public FieldType.Kind kind() { return FieldType.Kind.DATETIME; }

    @Override
    public Object coerce(Object v) {
      if (v == null || v instanceof Date) return v;
      if (v instanceof Instant i) return Date.from(i.truncatedTo(ChronoUnit.MILLIS));
      if (v instanceof OffsetDateTime o) return Date.from(o.toInstant().truncatedTo(ChronoUnit.MILLIS));
      if (v instanceof ZonedDateTime z) return Date.from(z.toInstant().truncatedTo(ChronoUnit.MILLIS));
      if (v instanceof LocalDateTime l) return Date.from(l.toInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS));
      if (v instanceof String s) return Date.from(Instant.parse(s).truncatedTo(ChronoUnit.MILLIS));
      throw new IllegalArgumentException("Cannot use " + v.getClass().getName() + " as a datetime");
    }

    @Override
    public Object decoerce(Object raw) {
      if (raw == null || raw instanceof Instant) return raw;
      if (raw instanceof Date d) return d.toInstant();
      if (raw instanceof String s) return Instant.parse(s);
      throw new IllegalArgumentException("Expected a datetime but got " + describe(raw));
    }
  }

  /** Dates are stored as BSON dates at UTC midnight. */
  static final class DateCodec implements MongoValueCodec {
    @Override public FieldType.Kind kind() { return FieldType.Kind.DATE; }

    @Override
    public Object coerce(Object v) {
      if (v == null || v instanceof Date) return v;
      if (v instanceof LocalDate d) return Date.from(d.atStartOfDay(ZoneOffset.UTC).toInstant());
      if (v instanceof String s) return Date.from(LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant());
      throw new IllegalArgumentException("Cannot use " + v.getClass().getName() + " as a date");
    }

    @Override
    public Object decoerce(Object raw) {
      if (raw == null || raw instanceof LocalDate) return raw;
      if (raw instanceof Date d) return LocalDate.ofInstant(d.toInstant(), ZoneOffset.UTC);
      if (raw instanceof String s) return LocalDate.parse(s);
      throw new IllegalArgumentException("Expected a date but got " + describe(raw));
    }
  }

  /** UUIDs are stored in their canonical string form. */
  static final class UuidCodec implements MongoValueCodec {
    @Override public FieldType.Kind kind() { return FieldType.Kind.UUID; }

    @Override
    public Object coerce(Object v) {
      if (v == null) return null;
      if (v instanceof UUID u) return u.toString();
      if (v instanceof String s) return UUID.fromString(s).toString();
      throw new IllegalArgumentException("Cannot use " + v.getClass().getName() + " as a uuid");
    }

    @Override
    public Object decoerce(Object raw) {
      if (raw == null || raw instanceof UUID) return raw;
      if (raw instanceof String s) return UUID.fromString(s);
      throw new IllegalArgumentException("Expected a uuid but got " + describe(raw));
    }
  }

  /** Embedded documents; nested values are left as stored, nested documents become plain maps. */
  static final class DocumentCodec implements MongoValueCodec {
    @Override public FieldType.Kind kind() { return FieldType.Kind.DOCUMENT; }

    @Override
    public Object coerce(Object v) {
      if (v == null || v instanceof Document) return v;
      if (v instanceof Map<?, ?> m) {
        Document d = new Document();
        for (var e : m.entrySet()) d.put(String.valueOf(e.getKey()), coerceNested(e.getValue()));
        return d;
      }
      throw new IllegalArgumentException("Cannot use " + v.getClass().getName() + " as a document");
    }

    @Override
    public Object decoerce(Object raw) {
      if (raw == null) return null;
      if (raw instanceof Map<?, ?>) return plain(raw);
      throw new IllegalArgumentException("Expected a document but got " + describe(raw));
    }

    private static Object coerceNested(Object v) {
      if (v instanceof Map<?, ?> m && !(v instanceof Document)) {
        Document d = new Document();
        for (var e : m.entrySet()) d.put(String.valueOf(e.getKey()), coerceNested(e.getValue()));
        return d;
      }
      if (v instanceof List<?> l) {
        List<Object> out = new ArrayList<>(l.size());
        for (Object x : l) out.add(coerceNested(x));
        return out;
      }
      return v;
    }

    private static Object plain(Object v) {
      if (v instanceof Map<?, ?> m) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (var e : m.entrySet()) out.put(String.valueOf(e.getKey()), plain(e.getValue()));
        return Collections.unmodifiableMap(out);
      }
      if (v instanceof List<?> l) {
        List<Object> out = new ArrayList<>(l.size());
        for (Object x : l) out.add(plain(x));
        return Collections.unmodifiableList(out);
      }
      return v;
    }
  }

  private static String describe(Object raw) {
    return raw.getClass().getSimpleName() + " value";
  }
}
