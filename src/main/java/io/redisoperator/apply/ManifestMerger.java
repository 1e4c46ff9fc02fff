package io.redisoperator.apply;

import com.fasterxml.jackson.databind.JsonNode;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServicePort;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.redisoperator.util.Manifests;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;

import static io.redisoperator.config.Constants.ANNOTATION_SPEC_HASH;

/**
 * Overlays the operator-managed fields of a desired manifest onto the live object.
 * <p>
 * Managed fields: own labels, annotations and owner reference on every kind; replicas,
 * pod template and update strategy of StatefulSets; selector and ports of Services;
 * data of ConfigMaps. Everything else on the live object, including labels and
 * annotations added by others, is left as found.
 * <p>
 * A managed subtree counts as drifted when any field set in the desired manifest is missing
 * or different on the live object, a list differs in length, or the live object has entries in a
 * pod template list the operator owns. Other fields only the live object has, such as server-side
 * defaults, do not count.
 */
public class ManifestMerger {

    /** Pod template lists the operator owns outright, so entries added by others are drift even when it sets none. */
    private static final List<String> OWNED_LISTS =
            List.of("containers", "initContainers", "volumes", "command", "args", "env", "envFrom", "volumeMounts");

    /**
     * @return the live object with desired fields applied, or empty when nothing managed differs
     */
    public <T extends HasMetadata> Optional<T> merge(T live, T desired) {
        T merged = Manifests.copy(live);
        boolean changed;
        if (live instanceof StatefulSet) {
            changed = mergeStatefulSet((StatefulSet) live, (StatefulSet) merged, (StatefulSet) desired);
        } else if (live instanceof Service) {
            changed = mergeService((Service) merged, (Service) desired);
        } else if (live instanceof ConfigMap) {
            changed = mergeConfigMap((ConfigMap) merged, (ConfigMap) desired);
        } else {
            changed = false;
        }
        changed |= mergeMetadata(merged.getMetadata(), desired.getMetadata());
        return changed ? Optional.of(merged) : Optional.empty();
    }

    private boolean mergeMetadata(ObjectMeta target, ObjectMeta desired) {
        boolean changed = false;
        if (desired.getLabels() != null && !desired.getLabels().isEmpty()) {
            Map<String, String> labels = overlay(target.getLabels(), desired.getLabels());
            changed |= !labels.equals(target.getLabels());
            target.setLabels(labels);
        }
        if (desired.getAnnotations() != null && !desired.getAnnotations().isEmpty()) {
            Map<String, String> annotations = overlay(target.getAnnotations(), desired.getAnnotations());
            changed |= !annotations.equals(target.getAnnotations());
            target.setAnnotations(annotations);
        }
        if (desired.getOwnerReferences() != null) {
            List<OwnerReference> references = target.getOwnerReferences() == null
                    ? new ArrayList<>()
                    : new ArrayList<>(target.getOwnerReferences());
            for (OwnerReference reference : desired.getOwnerReferences()) {
                if (Boolean.TRUE.equals(reference.getController())) {
                    // one controller per child; a stale one from an earlier object of the same name goes
                    changed |= references.removeIf(r -> Boolean.TRUE.equals(r.getController())
                            && !Objects.equals(r.getUid(), reference.getUid()));
                }
                boolean present = references.stream().anyMatch(r -> Objects.equals(r.getUid(), reference.getUid()));
                if (!present) {
                    references.add(reference);
                    changed = true;
                }
            }
            target.setOwnerReferences(references);
        }
        return changed;
    }

    private boolean mergeStatefulSet(StatefulSet live, StatefulSet target, StatefulSet desired) {
        boolean changed = false;
        if (!Objects.equals(live.getSpec().getReplicas(), desired.getSpec().getReplicas())) {
            target.getSpec().setReplicas(desired.getSpec().getReplicas());
            changed = true;
        }
        boolean specDrift = !Objects.equals(annotation(live, ANNOTATION_SPEC_HASH), annotation(desired, ANNOTATION_SPEC_HASH));
        if (specDrift
                || !containsManaged(live.getSpec().getTemplate(), desired.getSpec().getTemplate())
                || !containsManaged(live.getSpec().getUpdateStrategy(), desired.getSpec().getUpdateStrategy())) {
            // selector, serviceName, podManagementPolicy and volumeClaimTemplates are immutable
            target.getSpec().setTemplate(desired.getSpec().getTemplate());
            target.getSpec().setUpdateStrategy(desired.getSpec().getUpdateStrategy());
            changed = true;
        }
        return changed;
    }

    private boolean mergeService(Service target, Service desired) {
        boolean changed = false;
        if (!Objects.equals(target.getSpec().getSelector(), desired.getSpec().getSelector())) {
            target.getSpec().setSelector(desired.getSpec().getSelector());
            changed = true;
        }
        if (!portsEqual(target.getSpec().getPorts(), desired.getSpec().getPorts())) {
            target.getSpec().setPorts(carryNodePorts(target.getSpec().getPorts(), desired.getSpec().getPorts()));
            changed = true;
        }
        return changed;
    }

    private boolean mergeConfigMap(ConfigMap target, ConfigMap desired) {
        if (Objects.equals(target.getData(), desired.getData())) {
            return false;
        }
        target.setData(desired.getData());
        return true;
    }

    private static Map<String, String> overlay(Map<String, String> base, Map<String, String> desired) {
        Map<String, String> result = base == null ? new LinkedHashMap<>() : new LinkedHashMap<>(base);
        result.putAll(desired);
        return result;
    }

    private static String annotation(HasMetadata resource, String key) {
        Map<String, String> annotations = resource.getMetadata().getAnnotations();
        return annotations == null ? null : annotations.get(key);
    }

    private static boolean containsManaged(Object live, Object desired) {
        if (desired == null) {
            return true;
        }
        if (live == null) {
            return false;
        }
        return contains(Manifests.mapper().valueToTree(live), Manifests.mapper().valueToTree(desired));
    }

    private static boolean contains(JsonNode live, JsonNode desired) {
        if (desired == null || desired.isNull()) {
            return true;
        }
        if (live == null || live.isNull()) {
            return desired.isContainerNode() && desired.isEmpty();
        }
        if (live.isNumber() && desired.isNumber()) {
            return live.decimalValue().compareTo(desired.decimalValue()) == 0;
        }
        if (live.getNodeType() != desired.getNodeType()) {
            return false;
        }
        if (desired.isObject()) {
            for (String key : OWNED_LISTS) {
                JsonNode extra = live.get(key);
                if (!desired.has(key) && extra != null && !extra.isNull() && !extra.isEmpty()) {
                    return false;
                }
            }
            Iterator<Map.Entry<String, JsonNode>> fields = desired.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!contains(live.get(field.getKey()), field.getValue())) {
                    return false;
                }
            }
            return true;
        }
        if (desired.isArray()) {
            if (live.size() != desired.size()) {
                return false;
            }
            for (int i = 0; i < desired.size(); i++) {
                if (!contains(live.get(i), desired.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return live.equals(desired);
    }

    private static boolean portsEqual(List<ServicePort> live, List<ServicePort> desired) {
        List<ServicePort> left = live == null ? List.of() : live;
        List<ServicePort> right = desired == null ? List.of() : desired;
        if (left.size() != right.size()) {
            return false;
        }
        for (int i = 0; i < left.size(); i++) {
            ServicePort a = left.get(i);
            ServicePort b = right.get(i);
            if (!Objects.equals(a.getName(), b.getName())
                    || !Objects.equals(a.getPort(), b.getPort())
                    || !Objects.equals(a.getTargetPort(), b.getTargetPort())
                    || !Objects.equals(a.getProtocol(), b.getProtocol())) {
                return false;
            }
        }
        return true;
    }

    private static List<ServicePort> carryNodePorts(List<ServicePort> live, List<ServicePort> desired) {
        List<ServicePort> result = new ArrayList<>();
        for (ServicePort port : desired) {
            ServicePort copy = Manifests.copy(port);
            if (live != null) {
                live.stream()
                        .filter(p -> Objects.equals(p.getName(), port.getName()) && p.getNodePort() != null)
                        .findFirst()
                        .ifPresent(p -> copy.setNodePort(p.getNodePort()));
            }
            result.add(copy);
        }
        return result;
    }
}
