package com.skyport.panel.api.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.skyport.panel.api.model.ImageRecord;
import com.skyport.panel.api.model.InstanceRecord;
import com.skyport.panel.api.model.NodeRecord;
import com.skyport.panel.api.model.NodeRedeployResponse;
import com.skyport.panel.api.model.RedeployRequest;
import com.skyport.panel.api.repository.InstanceRepository;
import com.skyport.panel.api.repository.KeyLockRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Applies a redeployed instance to its three stored views: the per-user list, the global list and
 * the authoritative {@code {id}_instance} record. List entries of other instances are written back
 * exactly as they were read. Writes are re-read afterwards; a missing entry fails the update.
 */
@Service
public class InstanceStateUpdater {

    private static final Logger log = LoggerFactory.getLogger(InstanceStateUpdater.class);

    private final InstanceRepository instanceRepository;
    private final KeyLockRegistry keyLocks;
    private final Executor readExecutor;

    public InstanceStateUpdater(InstanceRepository instanceRepository,
                                KeyLockRegistry keyLocks,
                                @Qualifier("storeReadExecutor") Executor readExecutor) {
        this.instanceRepository = instanceRepository;
        this.keyLocks = keyLocks;
        this.readExecutor = readExecutor;
    }

    public InstanceRecord applyRedeploy(RedeployRequest request,
                                        String image,
                                        NodeRecord node,
                                        NodeRedeployResponse response,
                                        List<String> env,
                                        JsonNode imageData) {
        String instanceId = request.instanceId();
        String userId = request.userId();
        List<String> altImages = instanceRepository.findImage(image)
                .map(ImageRecord::altImages)
                .orElse(List.of());

        InstanceRecord updated = new InstanceRecord(
                request.name(),
                instanceId,
                node,
                userId,
                response.containerId(),
                instanceId,
                request.memory(),
                request.cpu(),
                request.ports(),
                request.primary(),
                env,
                image,
                altImages,
                imageData,
                Instant.now()
        );

        List<String> keys = List.of(
                InstanceRepository.userInstancesKey(userId),
                InstanceRepository.GLOBAL_INSTANCES_KEY,
                InstanceRepository.instanceKey(instanceId)
        );
        JsonNode entry = instanceRepository.toListEntry(updated);
        return keyLocks.withLocks(keys, () -> {
            CompletableFuture<ArrayNode> userInstances =
                    CompletableFuture.supplyAsync(() -> instanceRepository.findUserInstances(userId), readExecutor);
            CompletableFuture<ArrayNode> globalInstances =
                    CompletableFuture.supplyAsync(instanceRepository::findAllInstances, readExecutor);

            instanceRepository.saveUserInstances(userId, replaceEntry(join(userInstances), instanceId, entry));
            instanceRepository.saveAllInstances(replaceEntry(join(globalInstances), instanceId, entry));
            instanceRepository.saveInstance(updated);

            verify(userId, instanceId);
            log.debug("Stored redeployed instance {} (container {})", instanceId, updated.containerId());
            return updated;
        });
    }

    private void verify(String userId, String instanceId) {
        boolean inUserList = containsInstance(instanceRepository.findUserInstances(userId), instanceId);
        boolean inGlobalList = containsInstance(instanceRepository.findAllInstances(), instanceId);
        boolean recordPresent = instanceRepository.findInstance(instanceId).isPresent();
        if (!inUserList || !inGlobalList || !recordPresent) {
            log.warn("Verification of instance {} failed: userList={}, globalList={}, record={}",
                    instanceId, inUserList, inGlobalList, recordPresent);
            throw new RedeploymentException(
                    RedeployFailureKind.VERIFICATION_FAILED,
                    "Database verification failed after update"
            );
        }
    }

    private static ArrayNode replaceEntry(ArrayNode current, String instanceId, JsonNode updated) {
        ArrayNode result = current.arrayNode();
        for (JsonNode entry : current) {
            if (!isInstance(entry, instanceId)) {
                result.add(entry);
            }
        }
        result.add(updated.deepCopy());
        return result;
    }

    private static boolean containsInstance(ArrayNode instances, String instanceId) {
        for (JsonNode entry : instances) {
            if (isInstance(entry, instanceId)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isInstance(JsonNode entry, String instanceId) {
        JsonNode id = entry.path("Id");
        return id.isTextual() && instanceId.equals(id.asText());
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw ex;
        }
    }
}
