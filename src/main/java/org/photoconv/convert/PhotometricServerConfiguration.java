package org.photoconv.convert;

import org.photoconv.convert.tm33.IesToTm33Mapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 光度转换服务的 Bean 装配：路径白名单、待写入存储与 TM-33 映射器都由 {@link PhotometricServerProperties} 驱动。
 */
@Configuration(proxyBeanMethods = false)
public class PhotometricServerConfiguration {

    @Bean
    public SecurePathResolver securePathResolver(PhotometricServerProperties properties) {
        return new SecurePathResolver(properties.getRoots(), properties.isAllowSymlink());
    }

    @Bean
    public PendingFileWriteStore pendingFileWriteStore(PhotometricServerProperties properties) {
        return new PendingFileWriteStore(
                properties.getPendingWriteTtl(),
                properties.getPendingWriteMaxBytes().toBytes()
        );
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public IesToTm33Mapper iesToTm33Mapper(PhotometricServerProperties properties, Clock clock) {
        return new IesToTm33Mapper(clock, properties.getCreator(), properties.getCreatorVersion());
    }
}
