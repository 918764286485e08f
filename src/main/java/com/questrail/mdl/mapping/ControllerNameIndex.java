package com.questrail.mdl.mapping;

import com.questrail.mdl.model.ControllerNamespace;
import com.questrail.mdl.model.ControllerType;

import java.util.Optional;
import java.util.Set;

/**
 * ControllerNameIndex
 * -----------------------------------------------------------------------------
 * Mapping between controller types and the keyword text the ASCII format uses
 * for them.
 *
 * <h2>Why this exists</h2>
 * Legacy controller ids are only unique inside one payload namespace: id 88
 * is {@code radius} on a light and {@code birthrate} on an emitter. The name a
 * controller is written under therefore depends on which payloads the owning
 * node carries, not just on the controller itself.
 *
 * <h2>Namespace Priority</h2>
 * Both directions probe the node's namespaces in
 * {@link ControllerNamespace#PRIORITY} order (light, emitter, mesh, header);
 * the first hit wins. The header namespace is always available.
 */
public interface ControllerNameIndex
{
    /**
     * Keyword stem to write for a controller owned by a node with the given
     * namespaces.
     *
     * <p>Probes the namespaces by legacy id; when none has an entry for that
     * id the type's own {@link ControllerType#asciiName()} is used.</p>
     */
    String nameFor(ControllerType type, Set<ControllerNamespace> namespaces);

    /**
     * Resolves the first token of a body line.
     *
     * @param token keyword as written, any case, possibly suffixed with
     *              {@code key} or {@code bezierkey}
     * @param namespaces namespaces of the owning node
     * @return the controller keyword, or empty if the token names no
     *         controller in those namespaces
     */
    Optional<ControllerKeyword> resolve(String token, Set<ControllerNamespace> namespaces);

    /**
     * Reverse lookup by legacy id within one namespace.
     */
    Optional<ControllerType> typeFor(ControllerNamespace namespace, int legacyId);

    /**
     * Returns true if the token names a controller in any of the given
     * namespaces.
     */
    default boolean isControllerKeyword(String token, Set<ControllerNamespace> namespaces) {
        return resolve(token, namespaces).isPresent();
    }
}
