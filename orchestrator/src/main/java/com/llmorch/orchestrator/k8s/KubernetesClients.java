package com.llmorch.orchestrator.k8s;

import com.llmorch.orchestrator.config.OrchestratorConfig;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds the fabric8 client from the orchestrator configuration.
 */
public final class KubernetesClients {
    private KubernetesClients() {
    }

    /**
     * @throws IllegalArgumentException when the kubeconfig file cannot be read
     */
    public static KubernetesClient create(OrchestratorConfig config) {
        Config clientConfig;
        if (config.getKubeconfig() == null || config.getKubeconfig().isBlank()) {
            clientConfig = Config.autoConfigure(null);
        } else {
            try {
                clientConfig = Config.fromKubeconfig(Files.readString(Path.of(config.getKubeconfig())));
            } catch (IOException e) {
                throw new IllegalArgumentException("Cannot read kubeconfig " + config.getKubeconfig(), e);
            }
        }
        int timeoutMillis = (int) config.getPlatformTimeout().toMillis();
        clientConfig.setRequestTimeout(timeoutMillis);
        clientConfig.setConnectionTimeout(timeoutMillis);
        return new KubernetesClientBuilder().withConfig(clientConfig).build();
    }
}
