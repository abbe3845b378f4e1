package com.example.vehicleplatereader.service.intake;

import com.example.vehicleplatereader.TestFixtures;
import com.example.vehicleplatereader.service.RecognitionError;
import com.example.vehicleplatereader.service.RecognitionException;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageIntakeValidatorTest {

    private final ImageIntakeValidator validator = new ImageIntakeValidator(TestFixtures.properties(null));

    @Test
    void missingPartsAreRejected() {
        assertThatThrownBy(() -> validator.validateMultipart(null, null))
                .isInstanceOfSatisfying(RecognitionException.class,
                        ex -> assertThat(ex.error()).isEqualTo(RecognitionError.MISSING_INPUT))
                .hasMessageContaining("form-data with key \"image\" or \"file\"");
    }

    @Test
    void imagePartWinsOverFilePart() {
        MockMultipartFile image = new MockMultipartFile("image", "front.png", MediaType.IMAGE_PNG_VALUE, TestFixtures.pngBytes());
        MockMultipartFile file = new MockMultipartFile("file", "rear.jpg", MediaType.IMAGE_JPEG_VALUE, new byte[] {1, 2, 3});

        ImageSubmission submission = validator.validateMultipart(image, file);

        assertThat(submission.originalFilename()).isEqualTo("front.png");
        assertThat(submission.extension()).isEqualTo("png");
        assertThat(submission.origin()).isEqualTo(ImageSubmission.Origin.MULTIPART);
    }

    @Test
    void filePartIsAcceptedAlone() {
        MockMultipartFile file = new MockMultipartFile("file", "../secret/Car Photo.JPEG", MediaType.IMAGE_JPEG_VALUE, new byte[] {1, 2, 3});

        ImageSubmission submission = validator.validateMultipart(null, file);

        assertThat(submission.sanitizedFilename()).isEqualTo("Car_Photo.JPEG");
        assertThat(submission.extension()).isEqualTo("jpeg");
    }

    @Test
    void overlongFilenameIsShortenedButKeepsExtension() {
        MockMultipartFile image = new MockMultipartFile("image", "a".repeat(250) + ".png", MediaType.IMAGE_PNG_VALUE, TestFixtures.pngBytes());

        ImageSubmission submission = validator.validateMultipart(image, null);

        assertThat(submission.sanitizedFilename()).hasSizeLessThanOrEqualTo(100).endsWith(".png");
        assertThat(submission.extension()).isEqualTo("png");
    }

    @Test
    void blankFilenameIsMissingInput() {
        MockMultipartFile image = new MockMultipartFile("image", "", MediaType.IMAGE_PNG_VALUE, new byte[] {1});

        assertThatThrownBy(() -> validator.validateMultipart(image, null))
                .isInstanceOf(RecognitionException.class)
                .hasMessage("No file selected");
    }

    @Test
    void disallowedExtensionIsUnsupportedFormat() {
        MockMultipartFile image = new MockMultipartFile("image", "notes.txt", MediaType.TEXT_PLAIN_VALUE, new byte[] {1});

        assertThatThrownBy(() -> validator.validateMultipart(image, null))
                .isInstanceOfSatisfying(RecognitionException.class,
                        ex -> assertThat(ex.error()).isEqualTo(RecognitionError.UNSUPPORTED_FORMAT))
                .hasMessageStartingWith("Invalid file type. Allowed types: png, jpg, jpeg, gif, bmp");
    }

    @Test
    void filenameWithoutExtensionIsUnsupportedFormat() {
        MockMultipartFile image = new MockMultipartFile("image", "photo", MediaType.IMAGE_PNG_VALUE, new byte[] {1});

        assertThatThrownBy(() -> validator.validateMultipart(image, null))
                .isInstanceOfSatisfying(RecognitionException.class,
                        ex -> assertThat(ex.error()).isEqualTo(RecognitionError.UNSUPPORTED_FORMAT));
    }

    @Test
    void emptyPartIsMissingInput() {
        MockMultipartFile image = new MockMultipartFile("image", "car.png", MediaType.IMAGE_PNG_VALUE, new byte[0]);

        assertThatThrownBy(() -> validator.validateMultipart(image, null))
                .isInstanceOfSatisfying(RecognitionException.class,
                        ex -> assertThat(ex.error()).isEqualTo(RecognitionError.MISSING_INPUT));
    }

    @Test
    void oversizedPartIsRejected() {
        MockMultipartFile image = new MockMultipartFile("image", "car.png", MediaType.IMAGE_PNG_VALUE, new byte[70 * 1024]);

        assertThatThrownBy(() -> validator.validateMultipart(image, null))
                .isInstanceOfSatisfying(RecognitionException.class,
                        ex -> assertThat(ex.error()).isEqualTo(RecognitionError.PAYLOAD_TOO_LARGE));
    }

    @Test
    void rawImageBodyIsAcceptedWithJpgName() {
        ImageSubmission submission = validator.validateRawBody(new byte[] {9, 8, 7}, "image/webp");

        assertThat(submission.origin()).isEqualTo(ImageSubmission.Origin.RAW_BODY);
        assertThat(submission.sanitizedFilename()).isEqualTo("upload.jpg");
        assertThat(submission.extension()).isEqualTo("jpg");
        assertThat(submission.size()).isEqualTo(3);
    }

    @Test
    void emptyOrNonImageRawBodyIsMissingInput() {
        assertThatThrownBy(() -> validator.validateRawBody(new byte[0], "image/png"))
                .isInstanceOfSatisfying(RecognitionException.class,
                        ex -> assertThat(ex.error()).isEqualTo(RecognitionError.MISSING_INPUT));
        assertThatThrownBy(() -> validator.validateRawBody(null, "image/png"))
                .isInstanceOf(RecognitionException.class);
        assertThatThrownBy(() -> validator.validateRawBody(new byte[] {1}, "application/json"))
                .isInstanceOfSatisfying(RecognitionException.class,
                        ex -> assertThat(ex.error()).isEqualTo(RecognitionError.MISSING_INPUT));
    }
}
