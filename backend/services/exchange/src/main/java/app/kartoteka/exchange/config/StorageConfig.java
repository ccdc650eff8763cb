package app.kartoteka.exchange.config;

import app.kartoteka.exchange.storage.LocalObjectStorage;
import app.kartoteka.exchange.storage.ObjectStorage;
import app.kartoteka.exchange.storage.S3ObjectStorage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;
import java.nio.file.Path;

@Configuration
@EnableConfigurationProperties({StorageProps.class, S3Props.class})
public class StorageConfig {

    @Bean
    @ConditionalOnProperty(prefix = "app.storage", name = "type", havingValue = "s3")
    public S3Client s3Client(S3Props p) {
        var creds = AwsBasicCredentials.create(p.accessKey(), p.secretKey());

        var s3Config = S3Configuration.builder()
                .pathStyleAccessEnabled(p.pathStyleAccess())
                .build();

        return S3Client.builder()
                .region(Region.of(p.region()))
                .endpointOverride(URI.create(p.endpoint()))
                .credentialsProvider(StaticCredentialsProvider.create(creds))
                .serviceConfiguration(s3Config)
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.storage", name = "type", havingValue = "s3")
    public ObjectStorage s3ObjectStorage(S3Client s3Client, S3Props props) {
        return new S3ObjectStorage(s3Client, props);
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.storage", name = "type", havingValue = "local", matchIfMissing = true)
    public ObjectStorage localObjectStorage(StorageProps props) {
        String root = props.localRoot() == null || props.localRoot().isBlank()
                ? System.getProperty("java.io.tmpdir") + "/kartoteka-exchange"
                : props.localRoot();
        return new LocalObjectStorage(Path.of(root));
    }
}
