package com.ivamare.pipeline.handler.impl;

import com.ivamare.pipeline.exception.HandlerAlreadyRegisteredException;
import com.ivamare.pipeline.exception.UnsupportedActionException;
import com.ivamare.pipeline.handler.Action;
import com.ivamare.pipeline.handler.ActionContext;
import com.ivamare.pipeline.handler.ActionHandler;
import com.ivamare.pipeline.handler.ActionRegistry;
import com.ivamare.pipeline.model.ActionMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.config.BeanPostProcessor;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default ActionRegistry.
 *
 * <p>As a BeanPostProcessor it picks up {@link Action} methods from every bean in the
 * context.
 */
public class DefaultActionRegistry implements ActionRegistry, BeanPostProcessor {

    private static final Logger log = LoggerFactory.getLogger(DefaultActionRegistry.class);

    private final Map<ActionKey, ActionHandler> handlers = new ConcurrentHashMap<>();

    @Override
    public void register(String queueName, String action, ActionHandler handler) {
        ActionKey key = new ActionKey(queueName, action);
        if (handlers.putIfAbsent(key, handler) != null) {
            throw new HandlerAlreadyRegisteredException(queueName, action);
        }
        log.debug("Registered handler for {}.{}", queueName, action);
    }

    @Override
    public Optional<ActionHandler> get(String queueName, String action) {
        if (action == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(new ActionKey(queueName, action)));
    }

    @Override
    public boolean hasHandler(String queueName, String action) {
        return get(queueName, action).isPresent();
    }

    @Override
    public void dispatch(ActionMessage message, ActionContext context) throws Exception {
        ActionHandler handler = get(context.queueName(), message.action())
            .orElseThrow(() -> new UnsupportedActionException(context.queueName(), message.action()));
        log.debug("Dispatching {}.{} (messageId={}, delivery={})",
            context.queueName(), message.action(), context.messageId(), context.deliveryCount());
        handler.handle(message, context);
    }

    @Override
    public List<String> actionsFor(String queueName) {
        return handlers.keySet().stream()
            .filter(key -> key.queueName().equals(queueName))
            .map(ActionKey::action)
            .sorted()
            .toList();
    }

    @Override
    public List<ActionKey> registeredActions() {
        return List.copyOf(handlers.keySet());
    }

    @Override
    public List<ActionKey> registerBean(Object bean) {
        List<ActionKey> registered = new ArrayList<>();
        Class<?> targetClass = AopUtils.getTargetClass(bean);

        for (Method method : targetClass.getMethods()) {
            Action annotation = method.getAnnotation(Action.class);
            if (annotation == null) {
                continue;
            }
            validateActionMethod(method);

            register(annotation.queue(), annotation.name(), (message, context) -> invoke(bean, method, message, context));
            registered.add(new ActionKey(annotation.queue(), annotation.name()));

            log.info("Discovered action {}.{}() for {}.{}",
                targetClass.getSimpleName(), method.getName(), annotation.queue(), annotation.name());
        }
        return registered;
    }

    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) {
        for (Method method : AopUtils.getTargetClass(bean).getMethods()) {
            if (method.isAnnotationPresent(Action.class)) {
                registerBean(bean);
                break;
            }
        }
        return bean;
    }

    private static void invoke(Object bean, Method method, ActionMessage message, ActionContext context)
            throws Exception {
        try {
            method.invoke(bean, message, context);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw e;
        }
    }

    private static void validateActionMethod(Method method) {
        Class<?>[] params = method.getParameterTypes();
        if (params.length != 2
                || !params[0].equals(ActionMessage.class)
                || !params[1].equals(ActionContext.class)) {
            throw new IllegalArgumentException(
                "Action method " + method.getName() + " must have signature: "
                    + "void methodName(ActionMessage message, ActionContext context)");
        }
    }
}
