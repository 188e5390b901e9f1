package com.lookupgate.application.ports;

import com.lookupgate.domain.model.AdministratorAccount;
import com.lookupgate.domain.model.AdministratorUpdate;
import com.lookupgate.domain.model.NewAdministrator;

public interface AdministratorStore extends PrincipalStore<AdministratorAccount, NewAdministrator, AdministratorUpdate> {
}
