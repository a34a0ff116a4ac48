package com.nftgateway.nftdata.operation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Index of every {@link PagedOperation} bean by {@link PagedOperation#name()}.
 */
@Component
public class OperationRegistry {

    private static final Logger log = LoggerFactory.getLogger(OperationRegistry.class);

    private final Map<String, PagedOperation> operations = new LinkedHashMap<>();

    public OperationRegistry(List<PagedOperation> operations) {
        for (PagedOperation op : operations) {
            PagedOperation previous = this.operations.putIfAbsent(op.name(), op);
            if (previous != null) {
                throw new IllegalStateException("Duplicate operation name: " + op.name());
            }
        }
        log.info("Operations registered: {}", this.operations.keySet());
    }

    public Optional<PagedOperation> find(String name) {
        return Optional.ofNullable(name).map(operations::get);
    }

    public Set<String> names() {
        return operations.keySet();
    }
}
