package com.castleflow.castleflow_backend.engine;

import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyArray;
import org.graalvm.polyglot.proxy.ProxyObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversion between engine data (maps, lists, boxed scalars) and script values.
 * Maps and lists are handed to scripts as live views, so a script that assigns
 * {@code vars.x = 1} writes straight into the execution scope.
 */
final class GuestValues {

    private GuestValues() {
    }

    static Object toGuest(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean || value instanceof Character) {
            return value;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Double
                || value instanceof Float || value instanceof Short || value instanceof Byte) {
            return value;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Map<?, ?> map) {
            return new MapView(map);
        }
        if (value instanceof List<?> list) {
            return new ListView(list);
        }
        return String.valueOf(value);
    }

    static Object toHost(Value value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isProxyObject()) {
            Object proxy = value.asProxyObject();
            if (proxy instanceof MapView view) return view.map;
            if (proxy instanceof ListView view) return view.list;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isNumber()) {
            if (value.fitsInInt()) return value.asInt();
            if (value.fitsInLong()) return value.asLong();
            return value.asDouble();
        }
        if (value.isString()) {
            return value.asString();
        }
        if (value.isHostObject()) {
            return value.asHostObject();
        }
        if (value.isInstant()) {
            return value.asInstant().toString();
        }
        if (value.canExecute()) {
            return null;
        }
        if (value.hasArrayElements()) {
            List<Object> list = new ArrayList<>();
            long size = value.getArraySize();
            for (long i = 0; i < size; i++) {
                list.add(toHost(value.getArrayElement(i)));
            }
            return list;
        }
        if (value.hasMembers()) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (String key : value.getMemberKeys()) {
                map.put(key, toHost(value.getMember(key)));
            }
            return map;
        }
        return value.toString();
    }

    static final class MapView implements ProxyObject {

        final Map<String, Object> map;

        @SuppressWarnings("unchecked")
        MapView(Map<?, ?> map) {
            this.map = (Map<String, Object>) map;
        }

        @Override
        public Object getMember(String key) {
            return toGuest(map.get(key));
        }

        @Override
        public Object getMemberKeys() {
            return ProxyArray.fromArray(map.keySet().toArray());
        }

        @Override
        public boolean hasMember(String key) {
            return map.containsKey(key);
        }

        @Override
        public void putMember(String key, Value value) {
            map.put(key, toHost(value));
        }

        @Override
        public boolean removeMember(String key) {
            boolean present = map.containsKey(key);
            map.remove(key);
            return present;
        }
    }

    static final class ListView implements ProxyArray {

        final List<Object> list;

        @SuppressWarnings("unchecked")
        ListView(List<?> list) {
            this.list = (List<Object>) list;
        }

        @Override
        public Object get(long index) {
            return index >= 0 && index < list.size() ? toGuest(list.get((int) index)) : null;
        }

        @Override
        public void set(long index, Value value) {
            Object element = toHost(value);
            if (index == list.size()) {
                list.add(element);
            } else {
                list.set((int) index, element);
            }
        }

        @Override
        public long getSize() {
            return list.size();
        }
    }
}
