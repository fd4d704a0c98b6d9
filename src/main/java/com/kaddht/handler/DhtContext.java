package com.kaddht.handler;

import com.kaddht.config.DhtSettings;
import com.kaddht.core.Connectedness;
import com.kaddht.core.PeerId;
import com.kaddht.datastore.Datastore;
import com.kaddht.datastore.InMemoryDatastore;
import com.kaddht.provider.InMemoryProviderIndex;
import com.kaddht.provider.ProviderIndex;
import com.kaddht.record.NamespacedValidator;
import com.kaddht.record.PublicKeyValidator;
import com.kaddht.record.Validator;
import com.kaddht.routing.AddressBook;
import com.kaddht.routing.ConnectivityOracle;
import com.kaddht.routing.InMemoryAddressBook;
import com.kaddht.routing.RoutingTable;
import com.kaddht.routing.XorRoutingTable;

import java.time.Clock;
import java.util.Objects;

/**
 * Everything a handler needs to know about the node it runs in.
 *
 * <p>Built once at node startup and shared by all handlers; closed at shutdown,
 * which closes the datastore. Collaborators synchronize their own state.
 *
 * <p>Unset collaborators default to the in-memory implementations, and the
 * validator defaults to a {@link NamespacedValidator} accepting the {@code pk}
 * namespace.
 */
public class DhtContext implements AutoCloseable {

    private final PeerId self;
    private final Datastore datastore;
    private final Validator validator;
    private final ProviderIndex providers;
    private final RoutingTable routingTable;
    private final AddressBook addressBook;
    private final ConnectivityOracle connectivity;
    private final DhtSettings settings;
    private final Clock clock;

    private DhtContext(Builder builder) {
        this.self = builder.self;
        this.settings = builder.settings;
        this.clock = builder.clock;
        this.datastore = builder.datastore != null ? builder.datastore : new InMemoryDatastore();
        this.validator = builder.validator != null
                ? builder.validator
                : new NamespacedValidator().register("pk", new PublicKeyValidator());
        this.providers = builder.providers != null
                ? builder.providers
                : new InMemoryProviderIndex(clock, settings.getProvideValidity(), InMemoryProviderIndex.DEFAULT_CACHE_SIZE);
        this.routingTable = builder.routingTable != null ? builder.routingTable : new XorRoutingTable(self);
        this.addressBook = builder.addressBook != null ? builder.addressBook : new InMemoryAddressBook(clock);
        this.connectivity = builder.connectivity != null ? builder.connectivity : peer -> Connectedness.NOT_CONNECTED;
    }

    public static Builder builder(PeerId self) {
        return new Builder(self);
    }

    public PeerId getSelf() {
        return self;
    }

    public Datastore getDatastore() {
        return datastore;
    }

    public Validator getValidator() {
        return validator;
    }

    public ProviderIndex getProviders() {
        return providers;
    }

    public RoutingTable getRoutingTable() {
        return routingTable;
    }

    public AddressBook getAddressBook() {
        return addressBook;
    }

    public ConnectivityOracle getConnectivity() {
        return connectivity;
    }

    public DhtSettings getSettings() {
        return settings;
    }

    public Clock getClock() {
        return clock;
    }

    @Override
    public void close() {
        datastore.close();
    }

    public static class Builder {
        private final PeerId self;
        private Datastore datastore;
        private Validator validator;
        private ProviderIndex providers;
        private RoutingTable routingTable;
        private AddressBook addressBook;
        private ConnectivityOracle connectivity;
        private DhtSettings settings = DhtSettings.defaults();
        private Clock clock = Clock.systemUTC();

        private Builder(PeerId self) {
            this.self = Objects.requireNonNull(self, "self");
        }

        public Builder datastore(Datastore datastore) {
            this.datastore = datastore;
            return this;
        }

        public Builder validator(Validator validator) {
            this.validator = validator;
            return this;
        }

        public Builder providers(ProviderIndex providers) {
            this.providers = providers;
            return this;
        }

        public Builder routingTable(RoutingTable routingTable) {
            this.routingTable = routingTable;
            return this;
        }

        public Builder addressBook(AddressBook addressBook) {
            this.addressBook = addressBook;
            return this;
        }

        public Builder connectivity(ConnectivityOracle connectivity) {
            this.connectivity = connectivity;
            return this;
        }

        public Builder settings(DhtSettings settings) {
            this.settings = Objects.requireNonNull(settings);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        public DhtContext build() {
            return new DhtContext(this);
        }
    }
}
