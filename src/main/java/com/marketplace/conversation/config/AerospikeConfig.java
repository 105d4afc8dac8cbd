package com.marketplace.conversation.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AerospikeConfig {

    public static final String SET_CONVERSATIONS = "conversations";
    public static final String SET_BUYERS = "buyer_profiles";
    public static final String SET_PRODUCTS = "products";
    public static final String SET_AUDIT = "audit_entries";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:marketplace}")
    private String namespace;

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 100;
        clientPolicy.timeout = 5000;
        // Conversation analysis must keep working while the cluster is down.
        clientPolicy.failIfNotConnected = false;

        clientPolicy.readPolicyDefault.totalTimeout = 1000;
        clientPolicy.readPolicyDefault.socketTimeout = 500;

        clientPolicy.writePolicyDefault.totalTimeout = 1000;
        clientPolicy.writePolicyDefault.socketTimeout = 500;

        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = 1000;
        policy.socketTimeout = 500;
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = 1000;
        policy.socketTimeout = 500;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
