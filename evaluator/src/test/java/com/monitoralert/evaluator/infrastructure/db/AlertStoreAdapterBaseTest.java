package com.monitoralert.evaluator.infrastructure.db;

import com.monitoralert.evaluator.infrastructure.db.mapper.AlertRowMapper;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public abstract class AlertStoreAdapterBaseTest {

    @Mock
    AlertRowJpaRepository jpaRepository;

    @Mock
    AlertRowMapper mapper;

    @InjectMocks
    AlertStoreAdapter alertStore;

    AlertRow row(String id, Long version) {
        return AlertRow.builder().id(id).version(version).build();
    }
}
