package com.vidnyan.patternscan.adapter.out.plugin;

import com.vidnyan.patternscan.application.port.out.PluginFactory;
import com.vidnyan.patternscan.domain.error.PluginFaultException;
import com.vidnyan.patternscan.domain.plugin.AnalyzerPlugin;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Resolves plugin types against the application context. Types registered
 * at runtime that are not beans are created and autowired on demand.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpringPluginFactory implements PluginFactory {
    
    private final ApplicationContext context;
    
    @Override
    public AnalyzerPlugin create(String name, Class<? extends AnalyzerPlugin> type) {
        try {
            return context.getBean(type);
        } catch (NoSuchBeanDefinitionException e) {
            log.debug("Plugin '{}' is not a bean, creating {}", name, type.getName());
        }
        try {
            return context.getAutowireCapableBeanFactory().createBean(type);
        } catch (BeansException e) {
            throw new PluginFaultException(name, e);
        }
    }
}
