package com.questrail.mdl.mapping;

import com.questrail.mdl.model.ControllerNamespace;
import com.questrail.mdl.model.ControllerType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * LegacyControllerNameIndex
 * -----------------------------------------------------------------------------
 * {@link ControllerNameIndex} backed by per-namespace tables:
 *
 * <ul>
 *   <li>a map for legacy id -> type</li>
 *   <li>a map for lowercase name -> type</li>
 * </ul>
 *
 * {@link #standard()} holds every {@link ControllerType}, which reproduces the
 * tables of the legacy toolchain.
 */
public final class LegacyControllerNameIndex implements ControllerNameIndex
{
    private static final String KEY_SUFFIX = "key";
    private static final String BEZIER_KEY_SUFFIX = "bezierkey";

    private static final LegacyControllerNameIndex STANDARD =
        new LegacyControllerNameIndex(ControllerType.values());

    private final Map<ControllerNamespace, Map<Integer, ControllerType>> byId;
    private final Map<ControllerNamespace, Map<String, ControllerType>> byName;

    /**
     * Creates an index over the given types.
     *
     * @throws IllegalArgumentException if two types share a legacy id or a
     *         name within one namespace
     */
    public LegacyControllerNameIndex(ControllerType... types) {
        Objects.requireNonNull(types, "types");
        if (types.length == 0) {
            throw new IllegalArgumentException("At least one controller type is required");
        }

        Map<ControllerNamespace, Map<Integer, ControllerType>> ids = new EnumMap<>(ControllerNamespace.class);
        Map<ControllerNamespace, Map<String, ControllerType>> names = new EnumMap<>(ControllerNamespace.class);
        for (ControllerNamespace ns : ControllerNamespace.values()) {
            ids.put(ns, new HashMap<>());
            names.put(ns, new HashMap<>());
        }

        for (ControllerType type : types) {
            Objects.requireNonNull(type, "type");
            ControllerType prevId = ids.get(type.namespace()).put(type.legacyId(), type);
            if (prevId != null && prevId != type) {
                throw new IllegalArgumentException(
                    "Duplicate id " + type.legacyId() + " in " + type.namespace() + ": " + prevId + ", " + type);
            }
            ControllerType prevName = names.get(type.namespace()).put(lower(type.asciiName()), type);
            if (prevName != null && prevName != type) {
                throw new IllegalArgumentException(
                    "Duplicate name '" + type.asciiName() + "' in " + type.namespace());
            }
        }

        ids.replaceAll((ns, m) -> Collections.unmodifiableMap(m));
        names.replaceAll((ns, m) -> Collections.unmodifiableMap(m));
        this.byId = Collections.unmodifiableMap(ids);
        this.byName = Collections.unmodifiableMap(names);
    }

    public static LegacyControllerNameIndex standard() {
        return STANDARD;
    }

    @Override
    public String nameFor(ControllerType type, Set<ControllerNamespace> namespaces) {
        Objects.requireNonNull(type, "type");
        for (ControllerNamespace ns : ControllerNamespace.PRIORITY) {
            if (!namespaces.contains(ns)) {
                continue;
            }
            ControllerType hit = byId.get(ns).get(type.legacyId());
            if (hit != null) {
                return hit.asciiName();
            }
        }
        return type.asciiName();
    }

    @Override
    public Optional<ControllerKeyword> resolve(String token, Set<ControllerNamespace> namespaces) {
        Objects.requireNonNull(token, "token");
        final String t = lower(token);

        Optional<ControllerType> single = lookup(t, namespaces);
        if (single.isPresent()) {
            return Optional.of(ControllerKeyword.single(single.get()));
        }
        if (t.endsWith(BEZIER_KEY_SUFFIX)) {
            Optional<ControllerType> bezier = lookup(stem(t, BEZIER_KEY_SUFFIX), namespaces);
            if (bezier.isPresent()) {
                return Optional.of(new ControllerKeyword(bezier.get(), true, true));
            }
        }
        if (t.endsWith(KEY_SUFFIX)) {
            Optional<ControllerType> keyed = lookup(stem(t, KEY_SUFFIX), namespaces);
            if (keyed.isPresent()) {
                return Optional.of(new ControllerKeyword(keyed.get(), true, false));
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<ControllerType> typeFor(ControllerNamespace namespace, int legacyId) {
        Objects.requireNonNull(namespace, "namespace");
        return Optional.ofNullable(byId.get(namespace).get(legacyId));
    }

    private Optional<ControllerType> lookup(String name, Set<ControllerNamespace> namespaces) {
        if (name.isEmpty()) {
            return Optional.empty();
        }
        for (ControllerNamespace ns : ControllerNamespace.PRIORITY) {
            if (namespaces.contains(ns)) {
                ControllerType hit = byName.get(ns).get(name);
                if (hit != null) {
                    return Optional.of(hit);
                }
            }
        }
        return Optional.empty();
    }

    private static String stem(String token, String suffix) {
        return token.substring(0, token.length() - suffix.length());
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
