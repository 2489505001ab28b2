package by.greenmobile.retainingwall.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutionConfig {

    /** 0 = по числу процессоров. */
    @Value("${wall.execution.pool-size:0}")
    private int poolSize;

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor designExecutor() {
        int size = poolSize > 0 ? poolSize : Runtime.getRuntime().availableProcessors();
        return new MdcAwareExecutor(size);
    }
}
