package com.uplc.decompiler.convert;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.uplc.decompiler.term.ConstType;
import com.uplc.decompiler.term.Constant;
import com.uplc.decompiler.term.Hex;
import com.uplc.decompiler.term.PlutusData;

/**
 * Turns decoder payloads into canonical {@link Constant} values.
 *
 * Every accepted payload shape has its own branch; anything else is an
 * {@link IllegalArgumentException} naming the payload class.
 */
public final class PayloadNormalizer {

    /** Decoder-side byte buffer wrapper. */
    public interface ByteContainer {
        byte[] toByteArray();
    }

    /** Decoder-side big integer wrapper. */
    public interface IntegerContainer {
        BigInteger toBigInteger();
    }

    private PayloadNormalizer() {}

    /** Flat-encoding type tags to a constant type. Tag 7 (type application) is skipped. */
    public static ConstType decodeType(List<Integer> tags) {
        Iterator<Integer> it = tags.iterator();
        ConstType type = nextType(it);
        if (it.hasNext()) throw new IllegalArgumentException("trailing type tags in " + tags);
        return type;
    }

    private static ConstType nextType(Iterator<Integer> it) {
        while (it.hasNext()) {
            int tag = it.next();
            switch (tag) {
                case 0: return ConstType.INTEGER;
                case 1: return ConstType.BYTESTRING;
                case 2: return ConstType.STRING;
                case 3: return ConstType.UNIT;
                case 4: return ConstType.BOOL;
                case 5: return ConstType.list(nextType(it));
                case 6: {
                    ConstType fst = nextType(it);
                    return ConstType.pair(fst, nextType(it));
                }
                case 7: continue;
                case 8: return ConstType.DATA;
                case 9: return ConstType.G1_ELEMENT;
                case 10: return ConstType.G2_ELEMENT;
                case 11: return ConstType.ML_RESULT;
                default: throw new IllegalArgumentException("unknown constant type tag " + tag);
            }
        }
        throw new IllegalArgumentException("missing constant type tag");
    }

    public static Constant toConstant(ConstType type, Object payload) {
        switch (type.kind) {
            case INTEGER: return Constant.integer(toBigInteger(payload));
            case BYTESTRING: return Constant.bytes(toBytes(payload));
            case BLS12_381_G1_ELEMENT:
            case BLS12_381_G2_ELEMENT:
            case BLS12_381_ML_RESULT:
                return Constant.opaque(type, toBytes(payload));
            case STRING:
                if (payload instanceof String) return Constant.string((String) payload);
                return Constant.string(new String(toBytes(payload), StandardCharsets.UTF_8));
            case UNIT: return Constant.unit();
            case BOOL: return Constant.bool(toBoolean(payload));
            case DATA: return Constant.data(toData(payload));
            case LIST: {
                List<Constant> items = new ArrayList<>();
                for (Object o : toList(payload)) items.add(toConstant(type.first, o));
                return Constant.list(type.first, items);
            }
            case PAIR: {
                List<?> parts = pairParts(payload);
                return Constant.pair(toConstant(type.first, parts.get(0)), toConstant(type.second, parts.get(1)));
            }
            default:
                throw new IllegalArgumentException("unsupported constant type " + type);
        }
    }

    public static BigInteger toBigInteger(Object payload) {
        if (payload instanceof BigInteger) return (BigInteger) payload;
        if (payload instanceof Long || payload instanceof Integer || payload instanceof Short || payload instanceof Byte) {
            return BigInteger.valueOf(((Number) payload).longValue());
        }
        if (payload instanceof IntegerContainer) return ((IntegerContainer) payload).toBigInteger();
        if (payload instanceof String) {
            try {
                return new BigInteger(((String) payload).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("not an integer: " + payload, e);
            }
        }
        throw new IllegalArgumentException("integer payload of unsupported type " + describe(payload));
    }

    public static byte[] toBytes(Object payload) {
        if (payload instanceof byte[]) return ((byte[]) payload).clone();
        if (payload instanceof ByteContainer) return ((ByteContainer) payload).toByteArray();
        if (payload instanceof String) return Hex.decode((String) payload);
        if (payload instanceof DecodedData && ((DecodedData) payload).kind == DecodedData.Kind.BYTES) {
            return toBytes(((DecodedData) payload).payload);
        }
        throw new IllegalArgumentException("byte payload of unsupported type " + describe(payload));
    }

    public static PlutusData toData(Object payload) {
        if (payload instanceof PlutusData) return (PlutusData) payload;
        if (payload instanceof DecodedData) return fromDecoded((DecodedData) payload);
        throw new IllegalArgumentException("data payload of unsupported type " + describe(payload));
    }

    private static PlutusData fromDecoded(DecodedData d) {
        switch (d.kind) {
            case CONSTR: {
                BigInteger index = toBigInteger(d.index);
                if (index.signum() < 0 || index.bitLength() > 63) {
                    throw new IllegalArgumentException("constructor index out of range: " + index);
                }
                List<PlutusData> fields = new ArrayList<>();
                for (DecodedData f : d.items) fields.add(fromDecoded(f));
                return PlutusData.constr(index.longValue(), fields);
            }
            case MAP: {
                List<Map.Entry<PlutusData, PlutusData>> entries = new ArrayList<>();
                for (Map.Entry<DecodedData, DecodedData> e : d.entries) {
                    entries.add(Map.entry(fromDecoded(e.getKey()), fromDecoded(e.getValue())));
                }
                return PlutusData.map(entries);
            }
            case LIST: {
                List<PlutusData> items = new ArrayList<>();
                for (DecodedData i : d.items) items.add(fromDecoded(i));
                return PlutusData.list(items);
            }
            case INT: return PlutusData.integer(toBigInteger(d.payload));
            case BYTES: return PlutusData.bytes(toBytes(d.payload));
            default: throw new IllegalArgumentException("unknown data kind " + d.kind);
        }
    }

    private static boolean toBoolean(Object payload) {
        if (payload instanceof Boolean) return (Boolean) payload;
        if (payload instanceof String) {
            String s = ((String) payload).trim();
            if (s.equalsIgnoreCase("true")) return true;
            if (s.equalsIgnoreCase("false")) return false;
        }
        throw new IllegalArgumentException("bool payload of unsupported type " + describe(payload));
    }

    private static List<?> toList(Object payload) {
        if (payload instanceof List) return (List<?>) payload;
        if (payload instanceof Object[]) return List.of((Object[]) payload);
        throw new IllegalArgumentException("list payload of unsupported type " + describe(payload));
    }

    private static List<?> pairParts(Object payload) {
        if (payload instanceof Map.Entry) {
            Map.Entry<?, ?> e = (Map.Entry<?, ?>) payload;
            List<Object> parts = new ArrayList<>(2);
            parts.add(e.getKey());
            parts.add(e.getValue());
            return parts;
        }
        List<?> parts = toList(payload);
        if (parts.size() != 2) throw new IllegalArgumentException("pair payload with " + parts.size() + " elements");
        return parts;
    }

    private static String describe(Object payload) {
        return payload == null ? "null" : payload.getClass().getName();
    }
}
