package com.lookupgate.application.ports;

import com.lookupgate.domain.model.CustomerAccount;
import com.lookupgate.domain.model.CustomerUpdate;
import com.lookupgate.domain.model.NewCustomer;

public interface CustomerStore extends PrincipalStore<CustomerAccount, NewCustomer, CustomerUpdate> {
}
