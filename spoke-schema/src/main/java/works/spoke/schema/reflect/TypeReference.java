package works.spoke.schema.reflect;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/**
 * Captures a generic type for {@link ReflectiveTypeDescriber#describe(TypeReference)}.
 * Use an anonymous subclass: {@code new TypeReference<List<Fruit>>() { }}.
 */
@SuppressWarnings("unused") // The type parameter is used only via reflection
public abstract class TypeReference<T> {
	public Type reflectionType() {
		return ((ParameterizedType) getClass()
			.getGenericSuperclass()).getActualTypeArguments()[0];
	}
}
