package com.chicu.agentpulse.config;

import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class HttpClientConfig {

    /**
     * 🌐 Общий OkHttpClient: один пул соединений на экосистему, reasoning и Solana RPC.
     * Каждый клиент берёт newBuilder() и ставит свои таймауты.
     * Ретраи здесь не включаем: повтор записи решает RetryPolicy, а не транспорт.
     */
    @Bean
    public OkHttpClient okHttpClient(@Value("${agentpulse.http.user-agent:agentpulse/0.1}") String userAgent) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(30))
                .writeTimeout(Duration.ofSeconds(30))
                .connectionPool(new ConnectionPool(5, 2, TimeUnit.MINUTES))
                .retryOnConnectionFailure(false)
                .addInterceptor(chain -> chain.proceed(chain.request().newBuilder()
                        .header("User-Agent", userAgent)
                        .build()))
                .build();
    }
}
