package works.scenegen.reflect;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.FieldVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Arrays.asList;
import static org.objectweb.asm.ClassReader.SKIP_CODE;
import static org.objectweb.asm.ClassReader.SKIP_DEBUG;
import static org.objectweb.asm.ClassReader.SKIP_FRAMES;
import static org.objectweb.asm.Opcodes.ASM9;

public final class ReflectionHelpers {
	private ReflectionHelpers() { }

	/**
	 * {@link Class#getDeclaredFields()} makes no promise about order.
	 * This reads the class file, whose field order is the order of the source.
	 * <p>
	 * If the class file can't be found, falls back to {@link Class#getDeclaredFields()}.
	 *
	 * @throws IllegalStateException if the class file exists but can't be read
	 */
	public static List<Field> getDeclaredFieldsInOrder(Class<?> type) {
		String resource = "/" + type.getName().replace('.', '/') + ".class";
		List<String> names = new ArrayList<>();
		try (InputStream in = type.getResourceAsStream(resource)) {
			if (in == null) {
				LOGGER.debug("No class file for {}; using reflection order", type.getName());
				return asList(type.getDeclaredFields());
			}
			new ClassReader(in).accept(new ClassVisitor(ASM9) {
				@Override
				public FieldVisitor visitField(int access, String name, String descriptor, String signature, Object value) {
					names.add(name);
					return null;
				}
			}, SKIP_CODE | SKIP_DEBUG | SKIP_FRAMES);
		} catch (IOException e) {
			throw new IllegalStateException("Unable to read class file for " + type.getName(), e);
		}
		List<Field> result = new ArrayList<>(names.size());
		for (String name : names) {
			try {
				result.add(type.getDeclaredField(name));
			} catch (NoSuchFieldException e) {
				throw new IllegalStateException("Class file of " + type.getName() + " declares field \"" + name + "\" that reflection can't find", e);
			}
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ReflectionHelpers.class);
}
