package com.warden.controlplane.domain.provider;

import com.warden.controlplane.domain.EntityContext;
import com.warden.controlplane.domain.ServiceException;
import com.warden.database.NoRowsException;
import com.warden.database.Store;
import com.warden.database.StoreException;
import com.warden.database.model.Provider;
import java.util.List;

/** Read access to the providers configured in a project. */
public class ProviderService {

    private final Store store;

    public ProviderService(Store store) {
        this.store = store;
    }

    public List<Provider> list(EntityContext context) {
        try {
            return store.querier().listProvidersByProjectId(context.projectId());
        } catch (StoreException e) {
            throw ServiceException.internal("failed to list providers", e);
        }
    }

    public Provider get(EntityContext context, String name) {
        try {
            return store.querier().getProviderByName(context.projectId(), name);
        } catch (NoRowsException e) {
            throw ServiceException.notFound("provider not found");
        } catch (StoreException e) {
            throw ServiceException.internal("failed to get provider", e);
        }
    }
}
