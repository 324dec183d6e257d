package com.reliabledownloader.config;

import com.reliabledownloader.client.OkHttpRemoteContentClient;
import com.reliabledownloader.client.RemoteContentClient;
import com.reliabledownloader.client.S3RemoteContentClient;
import com.reliabledownloader.models.DownloaderProperties;
import com.reliabledownloader.models.S3Properties;
import com.reliabledownloader.services.ExponentialBackoff;
import com.reliabledownloader.services.RetryPolicy;
import com.reliabledownloader.services.SimpleRetryPolicy;
import okhttp3.OkHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.backoff.BackoffStrategy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

@Configuration
public class DownloaderConfiguration {

    @Bean
    public OkHttpClient okHttpClient(DownloaderProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(properties.connectTimeout())
                .readTimeout(properties.readTimeout())
                .followRedirects(true)
                .retryOnConnectionFailure(false) // whole-attempt retries only
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "downloader.transport", havingValue = DownloaderProperties.HTTP_TRANSPORT,
            matchIfMissing = true)
    public RemoteContentClient httpRemoteContentClient(OkHttpClient okHttpClient) {
        return new OkHttpRemoteContentClient(okHttpClient);
    }

    @Bean
    @ConditionalOnProperty(name = "downloader.transport", havingValue = DownloaderProperties.S3_TRANSPORT)
    public S3Client s3Client(S3Properties properties) {
        return S3Client.builder()
                .region(Region.of(properties.region()))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .retryPolicy(software.amazon.awssdk.core.retry.RetryPolicy.builder()
                                .numRetries(properties.maxRetries())
                                .backoffStrategy(BackoffStrategy.defaultStrategy())
                                .build())
                        .build())
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "downloader.transport", havingValue = DownloaderProperties.S3_TRANSPORT)
    public RemoteContentClient s3RemoteContentClient(S3Client s3Client, S3Properties properties) {
        return new S3RemoteContentClient(s3Client, properties.bucketName());
    }

    @Bean
    public RetryPolicy.Factory retryPolicyFactory(DownloaderProperties properties) {
        return SimpleRetryPolicy.Factory.create(properties.maxRetries());
    }

    @Bean
    public com.reliabledownloader.services.BackoffStrategy downloadBackoff(DownloaderProperties properties) {
        return new ExponentialBackoff(properties.initialBackoff(), properties.maxBackoff());
    }

    @Bean
    public AsyncTaskExecutor downloadTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("download-");
        executor.setKeepAliveSeconds(60);
        executor.initialize();
        return executor;
    }
}
