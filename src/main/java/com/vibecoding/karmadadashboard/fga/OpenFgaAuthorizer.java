package com.vibecoding.karmadadashboard.fga;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibecoding.karmadadashboard.exception.AuthorizationException;
import dev.openfga.sdk.api.client.OpenFgaClient;
import dev.openfga.sdk.api.client.model.ClientCheckRequest;
import dev.openfga.sdk.api.client.model.ClientTupleKey;
import dev.openfga.sdk.api.client.model.ClientTupleKeyWithoutCondition;
import dev.openfga.sdk.api.client.model.ClientWriteRequest;
import dev.openfga.sdk.api.configuration.ClientConfiguration;
import dev.openfga.sdk.api.model.CreateStoreRequest;
import dev.openfga.sdk.api.model.Store;
import dev.openfga.sdk.api.model.WriteAuthorizationModelRequest;
import dev.openfga.sdk.errors.FgaInvalidParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * OpenFGA Java SDK 기반 RelationshipAuthorizer
 * - 시작 시 store 를 찾거나 만들고, 인가 모델을 기록한다
 */
public class OpenFgaAuthorizer implements RelationshipAuthorizer {

    private static final Logger log = LoggerFactory.getLogger(OpenFgaAuthorizer.class);

    static final String MODEL_RESOURCE = "/fga/authorization-model.json";

    private final OpenFgaClient client;
    private final String storeName;
    private final ObjectMapper objectMapper;

    public OpenFgaAuthorizer(String apiUrl, String storeName, ObjectMapper objectMapper) {
        this.storeName = storeName;
        this.objectMapper = objectMapper;
        String url = apiUrl.contains("://") ? apiUrl : "http://" + apiUrl;
        try {
            this.client = new OpenFgaClient(new ClientConfiguration().apiUrl(url));
        } catch (FgaInvalidParameterException e) {
            throw new AuthorizationException("Invalid OpenFGA API URL " + url, e);
        }
        log.info("Initializing OpenFGA client: {}", url);
    }

    /**
     * store 를 이름으로 찾고 없으면 생성한 뒤 인가 모델을 기록
     */
    public void initialize() {
        try {
            String storeId = null;
            for (Store store : client.listStores().get().getStores()) {
                if (storeName.equals(store.getName())) {
                    storeId = store.getId();
                    break;
                }
            }
            if (storeId == null) {
                storeId = client.createStore(new CreateStoreRequest().name(storeName)).get().getId();
                log.info("Created OpenFGA store: {} ({})", storeName, storeId);
            }
            client.setStoreId(storeId);

            WriteAuthorizationModelRequest model;
            try (InputStream in = OpenFgaAuthorizer.class.getResourceAsStream(MODEL_RESOURCE)) {
                if (in == null) {
                    throw new AuthorizationException("Authorization model not found: " + MODEL_RESOURCE);
                }
                model = objectMapper.readValue(in, WriteAuthorizationModelRequest.class);
            }
            String modelId = client.writeAuthorizationModel(model).get().getAuthorizationModelId();
            client.setAuthorizationModelId(modelId);
            log.info("OpenFGA store ready: store={}, model={}", storeId, modelId);
        } catch (IOException | FgaInvalidParameterException | ExecutionException e) {
            throw new AuthorizationException("Failed to initialize OpenFGA store", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthorizationException("Interrupted while initializing OpenFGA store", e);
        }
    }

    @Override
    public boolean check(String user, String relation, String objectType, String objectId) {
        ClientCheckRequest request = new ClientCheckRequest()
            .user(formatUser(user))
            .relation(relation)
            ._object(formatObject(objectType, objectId));
        try {
            Boolean allowed = client.check(request).get().getAllowed();
            return Boolean.TRUE.equals(allowed);
        } catch (FgaInvalidParameterException | ExecutionException e) {
            throw new AuthorizationException("OpenFGA check error", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthorizationException("Interrupted during OpenFGA check", e);
        }
    }

    @Override
    public void writeTuple(String user, String relation, String objectType, String objectId) {
        log.debug("Writing tuple: {} {} {}", user, relation, formatObject(objectType, objectId));
        ClientTupleKey tuple = new ClientTupleKey()
            .user(formatUser(user))
            .relation(relation)
            ._object(formatObject(objectType, objectId));
        write(new ClientWriteRequest().writes(List.of(tuple)), "write tuple");
    }

    @Override
    public void deleteTuple(String user, String relation, String objectType, String objectId) {
        log.debug("Deleting tuple: {} {} {}", user, relation, formatObject(objectType, objectId));
        ClientTupleKeyWithoutCondition tuple = new ClientTupleKeyWithoutCondition()
            .user(formatUser(user))
            .relation(relation)
            ._object(formatObject(objectType, objectId));
        write(new ClientWriteRequest().deletes(List.of(tuple)), "delete tuple");
    }

    private void write(ClientWriteRequest request, String operation) {
        try {
            client.write(request).get();
        } catch (FgaInvalidParameterException | ExecutionException e) {
            throw new AuthorizationException("failed to " + operation, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthorizationException("Interrupted during OpenFGA " + operation, e);
        }
    }

    static String formatUser(String user) {
        return "user:" + user;
    }

    static String formatObject(String objectType, String objectId) {
        return objectType + ":" + objectId;
    }
}
