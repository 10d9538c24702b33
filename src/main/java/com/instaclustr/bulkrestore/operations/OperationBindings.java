package com.instaclustr.bulkrestore.operations;

import com.google.inject.Binder;
import com.google.inject.TypeLiteral;
import com.google.inject.assistedinject.FactoryModuleBuilder;
import com.google.inject.multibindings.MapBinder;
import com.google.inject.util.Types;

public final class OperationBindings {

    private OperationBindings() {
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    public static <RequestT extends OperationRequest, OperationT extends Operation<RequestT>>
    void installOperationBindings(final Binder binder,
                                  final String typeId,
                                  final Class<RequestT> requestClass,
                                  final Class<OperationT> operationClass) {

        final TypeLiteral<OperationFactory<RequestT>> operationFactoryType =
            (TypeLiteral<OperationFactory<RequestT>>) TypeLiteral.get(Types.newParameterizedType(OperationFactory.class, requestClass));

        binder.install(new FactoryModuleBuilder()
                           .implement(Operation.class, operationClass)
                           .build(operationFactoryType));

        // Map<Class<? extends OperationRequest>, OperationFactory>
        MapBinder.newMapBinder(binder,
                               new TypeLiteral<Class<? extends OperationRequest>>() {},
                               new TypeLiteral<OperationFactory>() {})
            .addBinding(requestClass).to(operationFactoryType);

        // Map<String, Class<? extends OperationRequest>>
        MapBinder.newMapBinder(binder,
                               new TypeLiteral<String>() {},
                               new TypeLiteral<Class<? extends OperationRequest>>() {})
            .addBinding(typeId).toInstance(requestClass);
    }
}
